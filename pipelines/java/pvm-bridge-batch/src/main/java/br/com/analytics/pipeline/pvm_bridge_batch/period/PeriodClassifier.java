package br.com.analytics.pipeline.pvm_bridge_batch.period;

import br.com.analytics.pipeline.pvm_bridge_batch.model.FiscalYearWindow;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodRange;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodTag;
import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Fiscal calendar arithmetic and period membership. All methods are pure.
 */
public final class PeriodClassifier {

    static final long MAX_GAP_DAYS = 365L;

    private PeriodClassifier() {
    }

    /**
     * Fiscal year of {@code date}: a month after the year-end month belongs to the next fiscal year.
     * With a June year end, 2024-07-01 is FY2025 and 2024-06-30 is FY2024.
     */
    public static int fiscalYearOf(LocalDate date, int fiscalYearEndMonth) {
        requireMonth(fiscalYearEndMonth);
        return date.getMonthValue() > fiscalYearEndMonth ? date.getYear() + 1 : date.getYear();
    }

    public static PeriodRange fiscalYearRange(int fiscalYear, int fiscalYearEndMonth) {
        requireMonth(fiscalYearEndMonth);
        LocalDate start = fiscalYearEndMonth == 12
                ? LocalDate.of(fiscalYear, 1, 1)
                : LocalDate.of(fiscalYear - 1, fiscalYearEndMonth + 1, 1);
        LocalDate end = YearMonth.of(fiscalYear, fiscalYearEndMonth).atEndOfMonth();
        return new PeriodRange(start, end);
    }

    /**
     * Last twelve months ending on {@code endDate}, starting the day after the same date one year
     * earlier.
     */
    public static PeriodRange ltmRange(LocalDate endDate) {
        return new PeriodRange(endDate.minusYears(1).plusDays(1), endDate);
    }

    public static int priorFiscalYear(LocalDate ltmEndDate, int fiscalYearEndMonth) {
        return fiscalYearOf(ltmEndDate, fiscalYearEndMonth) - 1;
    }

    /**
     * Every fiscal year touched by [{@code min}, {@code max}], ascending, flagged fully covered when
     * the data spans the whole fiscal year.
     */
    public static List<FiscalYearWindow> detectFiscalYears(LocalDate min, LocalDate max, int fiscalYearEndMonth) {
        List<FiscalYearWindow> windows = new ArrayList<>();
        if (min.isAfter(max)) {
            return windows;
        }
        int first = fiscalYearOf(min, fiscalYearEndMonth);
        int last = fiscalYearOf(max, fiscalYearEndMonth);
        for (int fiscalYear = first; fiscalYear <= last; fiscalYear++) {
            PeriodRange range = fiscalYearRange(fiscalYear, fiscalYearEndMonth);
            windows.add(new FiscalYearWindow(fiscalYear, range, isCovered(range, min, max)));
        }
        return windows;
    }

    /**
     * Fiscal year holding the latest observed date, the default current year of a two-period run.
     */
    public static int defaultCurrentFiscalYear(LocalDate maxDate, int fiscalYearEndMonth) {
        return fiscalYearOf(maxDate, fiscalYearEndMonth);
    }

    public static List<FiscalYearWindow> fullyCovered(List<FiscalYearWindow> windows) {
        List<FiscalYearWindow> covered = new ArrayList<>();
        for (FiscalYearWindow window : windows) {
            if (window.fullyCovered()) {
                covered.add(window);
            }
        }
        return covered;
    }

    /**
     * Multi-year bridging needs at least two fully covered fiscal years.
     */
    public static boolean supportsMultiYear(List<FiscalYearWindow> windows) {
        return fullyCovered(windows).size() >= 2;
    }

    public static boolean isCovered(PeriodRange range, @Nullable LocalDate min, @Nullable LocalDate max) {
        return min != null && max != null && !min.isAfter(range.start()) && !max.isBefore(range.end());
    }

    /**
     * PY when inside the prior range, else CY when inside the current range, else null. Overlapping
     * dates resolve to PY.
     */
    public static @Nullable PeriodTag classifyPeriod(LocalDate date, PeriodRange prior, PeriodRange current) {
        if (prior.contains(date)) {
            return PeriodTag.PRIOR_YEAR;
        }
        if (current.contains(date)) {
            return PeriodTag.CURRENT_YEAR;
        }
        return null;
    }

    /**
     * First window containing {@code date}, or -1.
     */
    public static int classifyFiscalYear(LocalDate date, List<FiscalYearWindow> windows) {
        for (int i = 0; i < windows.size(); i++) {
            if (windows.get(i).range().contains(date)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Flags, never blocks, overlapping PY/CY ranges and gaps over a year between them. Inverted
     * ranges are errors.
     */
    public static PeriodValidation validate(PeriodRange prior, PeriodRange current) {
        List<String> warnings = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        if (prior.isInverted()) {
            errors.add("Prior Year range " + prior + " ends before it starts.");
        }
        if (current.isInverted()) {
            errors.add("Current Year range " + current + " ends before it starts.");
        }
        if (!prior.end().isBefore(current.start())) {
            warnings.add("Prior Year and Current Year periods overlap. Some data may be counted in both periods.");
        }
        long gapDays = prior.gapDaysUntil(current);
        if (gapDays > MAX_GAP_DAYS) {
            warnings.add("There is a " + gapDays + " day gap between Prior Year and Current Year. Some data may be excluded.");
        }
        return new PeriodValidation(warnings, errors);
    }

    public static PeriodValidation validate(List<FiscalYearWindow> windows) {
        List<String> errors = new ArrayList<>();
        if (windows.size() < 2) {
            errors.add("At least two fiscal years are required for a multi-year bridge.");
        }
        for (int i = 0; i < windows.size(); i++) {
            FiscalYearWindow window = windows.get(i);
            if (window.range().isInverted()) {
                errors.add(window.label() + " range " + window.range() + " ends before it starts.");
            }
            for (int j = i + 1; j < windows.size(); j++) {
                if (window.range().overlaps(windows.get(j).range())) {
                    errors.add(window.label() + " overlaps " + windows.get(j).label() + ".");
                }
            }
        }
        return new PeriodValidation(List.of(), errors);
    }

    private static void requireMonth(int month) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Fiscal year end month must be 1-12, was " + month);
        }
    }
}
