package br.com.analytics.pipeline.pvm_bridge_batch.period;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Date format detection and parsing over the {@link DateFormatDescriptor} catalog.
 */
public final class DateFormats {

    static final int MIN_YEAR = 1900;
    static final int MAX_YEAR = 2100;
    static final double AMBIGUITY_THRESHOLD = 0.1d;

    private DateFormats() {
    }

    /**
     * Scores every catalog format by the fraction of non-blank samples that match it and parse to a
     * year in [1900, 2100]. The first format with the highest score wins. When the slash-delimited
     * month/day orderings score within 0.1 of each other, the first sample with a component above
     * 12 decides which one is the day.
     */
    public static DateFormatDetection detect(List<String> samples) {
        List<String> valid = new ArrayList<>();
        for (String sample : samples) {
            if (sample != null && !sample.isBlank()) {
                valid.add(sample.trim());
            }
        }
        if (valid.isEmpty()) {
            return DateFormatDetection.NONE;
        }

        Map<DateFormatDescriptor, Double> scores = new EnumMap<>(DateFormatDescriptor.class);
        for (DateFormatDescriptor format : DateFormatDescriptor.values()) {
            int validDates = 0;
            for (String sample : valid) {
                Optional<LocalDate> parsed = format.parse(sample);
                if (parsed.isPresent() && parsed.get().getYear() >= MIN_YEAR && parsed.get().getYear() <= MAX_YEAR) {
                    validDates++;
                }
            }
            scores.put(format, (double) validDates / valid.size());
        }

        DateFormatDescriptor best = null;
        double bestScore = 0d;
        for (DateFormatDescriptor format : DateFormatDescriptor.values()) {
            double score = scores.get(format);
            if (score > bestScore) {
                bestScore = score;
                best = format;
            }
        }
        if (best == null) {
            return DateFormatDetection.NONE;
        }

        if (best == DateFormatDescriptor.US_SLASH || best == DateFormatDescriptor.EUROPEAN_SLASH) {
            double monthFirst = scores.get(DateFormatDescriptor.US_SLASH);
            double dayFirst = scores.get(DateFormatDescriptor.EUROPEAN_SLASH);
            if (Math.abs(monthFirst - dayFirst) < AMBIGUITY_THRESHOLD) {
                DateFormatDescriptor resolved = disambiguateSlashOrder(valid);
                if (resolved != null) {
                    best = resolved;
                }
            }
        }
        return new DateFormatDetection(best, bestScore);
    }

    /**
     * Parses with the named format. An unknown id falls back to detection on this single value.
     */
    public static Optional<LocalDate> parse(@Nullable String text, @Nullable String formatId) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        DateFormatDescriptor format = DateFormatDescriptor.byId(formatId);
        if (format == null) {
            format = detect(List.of(text)).format();
            if (format == null) {
                return Optional.empty();
            }
        }
        return format.parse(text);
    }

    private static @Nullable DateFormatDescriptor disambiguateSlashOrder(List<String> samples) {
        for (String sample : samples) {
            String[] parts = sample.split("/");
            if (parts.length != 3) {
                continue;
            }
            int first = component(parts[0]);
            int second = component(parts[1]);
            if (first > 12 && first <= 31) {
                return DateFormatDescriptor.EUROPEAN_SLASH;
            }
            if (second > 12 && second <= 31) {
                return DateFormatDescriptor.US_SLASH;
            }
        }
        return null;
    }

    private static int component(String part) {
        String trimmed = part.trim();
        if (trimmed.isEmpty() || trimmed.length() > 2) {
            return -1;
        }
        for (int i = 0; i < trimmed.length(); i++) {
            if (!Character.isDigit(trimmed.charAt(i))) {
                return -1;
            }
        }
        return Integer.parseInt(trimmed);
    }
}
