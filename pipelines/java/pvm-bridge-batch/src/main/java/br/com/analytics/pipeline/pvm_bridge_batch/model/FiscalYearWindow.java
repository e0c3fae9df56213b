package br.com.analytics.pipeline.pvm_bridge_batch.model;

public record FiscalYearWindow(
        int fiscalYear,
        PeriodRange range,
        boolean fullyCovered
) {

    public PeriodTag tag() {
        return PeriodTag.ofFiscalYear(fiscalYear);
    }

    public String label() {
        return "FY" + fiscalYear;
    }

    public FiscalYearWindow withCoverage(boolean covered) {
        return new FiscalYearWindow(fiscalYear, range, covered);
    }
}
