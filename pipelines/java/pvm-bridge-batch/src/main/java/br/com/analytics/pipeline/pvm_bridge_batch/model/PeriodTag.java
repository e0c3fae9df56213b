package br.com.analytics.pipeline.pvm_bridge_batch.model;

import java.util.Objects;

/**
 * Label of an analysis period: {@code PY}/{@code CY} in two-period mode, the fiscal year number in
 * multi-year mode.
 */
public record PeriodTag(
        String id
) {

    public static final PeriodTag PRIOR_YEAR = new PeriodTag("PY");
    public static final PeriodTag CURRENT_YEAR = new PeriodTag("CY");

    public PeriodTag {
        Objects.requireNonNull(id, "id");
    }

    public static PeriodTag ofFiscalYear(int fiscalYear) {
        return new PeriodTag(Integer.toString(fiscalYear));
    }

    @Override
    public String toString() {
        return id;
    }
}
