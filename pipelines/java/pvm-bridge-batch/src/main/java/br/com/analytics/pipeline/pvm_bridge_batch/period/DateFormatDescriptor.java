package br.com.analytics.pipeline.pvm_bridge_batch.period;

import org.jspecify.annotations.Nullable;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Catalog of recognised date layouts, in detection order. Parsing is strict: a string that matches
 * the layout but names an impossible calendar day does not parse.
 */
public enum DateFormatDescriptor {

    ISO_DATE("YYYY-MM-DD", "^(\\d{4})-(\\d{2})-(\\d{2})$", "2024-01-15") {
        @Override
        Optional<LocalDate> parseMatched(Matcher m) {
            return date(m.group(1), m.group(2), m.group(3));
        }
    },
    US_SLASH("MM/DD/YYYY", "^(\\d{1,2})/(\\d{1,2})/(\\d{4})$", "01/15/2024") {
        @Override
        Optional<LocalDate> parseMatched(Matcher m) {
            return date(m.group(3), m.group(1), m.group(2));
        }
    },
    EUROPEAN_SLASH("DD/MM/YYYY", "^(\\d{1,2})/(\\d{1,2})/(\\d{4})$", "15/01/2024") {
        @Override
        Optional<LocalDate> parseMatched(Matcher m) {
            return date(m.group(3), m.group(2), m.group(1));
        }
    },
    US_DASH("MM-DD-YYYY", "^(\\d{1,2})-(\\d{1,2})-(\\d{4})$", "01-15-2024") {
        @Override
        Optional<LocalDate> parseMatched(Matcher m) {
            return date(m.group(3), m.group(1), m.group(2));
        }
    },
    DAY_MONTH_NAME("DD-MMM-YYYY", "^(\\d{1,2})-([A-Za-z]{3})-(\\d{4})$", "15-Jan-2024") {
        @Override
        Optional<LocalDate> parseMatched(Matcher m) {
            return namedMonthDate(m.group(3), m.group(2), m.group(1));
        }
    },
    MONTH_NAME_DAY("MMM DD, YYYY", "^([A-Za-z]{3})\\s+(\\d{1,2}),?\\s+(\\d{4})$", "Jan 15, 2024") {
        @Override
        Optional<LocalDate> parseMatched(Matcher m) {
            return namedMonthDate(m.group(3), m.group(1), m.group(2));
        }
    },
    COMPACT("YYYYMMDD", "^(\\d{4})(\\d{2})(\\d{2})$", "20240115") {
        @Override
        Optional<LocalDate> parseMatched(Matcher m) {
            return date(m.group(1), m.group(2), m.group(3));
        }
    },
    US_SLASH_SHORT("M/D/YYYY", "^(\\d{1,2})/(\\d{1,2})/(\\d{4})$", "1/5/2024") {
        @Override
        Optional<LocalDate> parseMatched(Matcher m) {
            return date(m.group(3), m.group(1), m.group(2));
        }
    };

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3),
            Map.entry("apr", 4), Map.entry("may", 5), Map.entry("jun", 6),
            Map.entry("jul", 7), Map.entry("aug", 8), Map.entry("sep", 9),
            Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12));

    private final String id;
    private final Pattern pattern;
    private final String example;

    DateFormatDescriptor(String id, String regex, String example) {
        this.id = id;
        this.pattern = Pattern.compile(regex);
        this.example = example;
    }

    public String id() {
        return id;
    }

    public String example() {
        return example;
    }

    public boolean matches(String text) {
        return pattern.matcher(text.trim()).matches();
    }

    public Optional<LocalDate> parse(String text) {
        Matcher matcher = pattern.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return parseMatched(matcher);
    }

    abstract Optional<LocalDate> parseMatched(Matcher matcher);

    public static @Nullable DateFormatDescriptor byId(@Nullable String id) {
        if (id == null) {
            return null;
        }
        for (DateFormatDescriptor descriptor : values()) {
            if (descriptor.id.equals(id)) {
                return descriptor;
            }
        }
        return null;
    }

    private static Optional<LocalDate> date(String year, String month, String day) {
        return of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
    }

    private static Optional<LocalDate> namedMonthDate(String year, String monthName, String day) {
        Integer month = MONTHS.get(monthName.toLowerCase(Locale.ROOT));
        if (month == null) {
            return Optional.empty();
        }
        return of(Integer.parseInt(year), month, Integer.parseInt(day));
    }

    private static Optional<LocalDate> of(int year, int month, int day) {
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
