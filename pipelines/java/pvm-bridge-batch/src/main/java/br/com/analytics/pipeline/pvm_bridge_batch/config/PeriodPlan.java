package br.com.analytics.pipeline.pvm_bridge_batch.config;

import br.com.analytics.pipeline.pvm_bridge_batch.model.FiscalYearWindow;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodMode;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodRange;
import br.com.analytics.pipeline.pvm_bridge_batch.model.PeriodTag;
import br.com.analytics.pipeline.pvm_bridge_batch.period.PeriodClassifier;
import br.com.analytics.pipeline.pvm_bridge_batch.period.PeriodValidation;
import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Periods a run classifies rows into: a PY/CY pair, or an ordered list of non-overlapping fiscal
 * years.
 */
public final class PeriodPlan {

    private final PeriodMode mode;
    private final @Nullable PeriodRange prior;
    private final @Nullable PeriodRange current;
    private final List<FiscalYearWindow> fiscalYears;
    private final PeriodValidation validation;

    private PeriodPlan(PeriodMode mode, @Nullable PeriodRange prior, @Nullable PeriodRange current,
                       List<FiscalYearWindow> fiscalYears, PeriodValidation validation) {
        this.mode = mode;
        this.prior = prior;
        this.current = current;
        this.fiscalYears = List.copyOf(fiscalYears);
        this.validation = validation;
    }

    public static PeriodPlan twoPeriod(PeriodRange prior, PeriodRange current) {
        PeriodValidation validation = PeriodClassifier.validate(prior, current);
        if (!validation.valid()) {
            throw new ConfigurationException(String.join(" ", validation.errors()));
        }
        return new PeriodPlan(PeriodMode.TWO_PERIOD, prior, current, List.of(), validation);
    }

    public static PeriodPlan multiYear(List<FiscalYearWindow> fiscalYears) {
        PeriodValidation validation = PeriodClassifier.validate(fiscalYears);
        if (!validation.valid()) {
            throw new ConfigurationException(String.join(" ", validation.errors()));
        }
        return new PeriodPlan(PeriodMode.MULTI_YEAR, null, null, fiscalYears, validation);
    }

    public PeriodMode mode() {
        return mode;
    }

    public PeriodRange prior() {
        if (prior == null) {
            throw new IllegalStateException("No PY range in " + mode + " mode");
        }
        return prior;
    }

    public PeriodRange current() {
        if (current == null) {
            throw new IllegalStateException("No CY range in " + mode + " mode");
        }
        return current;
    }

    public List<FiscalYearWindow> fiscalYears() {
        return fiscalYears;
    }

    public List<String> warnings() {
        return validation.warnings();
    }

    /**
     * Period tags in analysis order.
     */
    public List<PeriodTag> tags() {
        if (mode == PeriodMode.TWO_PERIOD) {
            return List.of(PeriodTag.PRIOR_YEAR, PeriodTag.CURRENT_YEAR);
        }
        List<PeriodTag> tags = new ArrayList<>(fiscalYears.size());
        for (FiscalYearWindow window : fiscalYears) {
            tags.add(window.tag());
        }
        return tags;
    }

    /**
     * Index into {@link #tags()} of the period holding {@code date}, or -1 when outside every period.
     */
    public int classify(LocalDate date) {
        if (mode == PeriodMode.TWO_PERIOD) {
            PeriodTag tag = PeriodClassifier.classifyPeriod(date, prior(), current());
            if (tag == null) {
                return -1;
            }
            return tag.equals(PeriodTag.PRIOR_YEAR) ? 0 : 1;
        }
        return PeriodClassifier.classifyFiscalYear(date, fiscalYears);
    }
}
