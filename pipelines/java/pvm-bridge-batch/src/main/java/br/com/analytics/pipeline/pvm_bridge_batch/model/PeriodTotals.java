package br.com.analytics.pipeline.pvm_bridge_batch.model;

public record PeriodTotals(
        double sales,
        double quantity,
        double cost,
        long count
) {

    public static final PeriodTotals ZERO = new PeriodTotals(0d, 0d, 0d, 0L);

    public PeriodTotals plus(PeriodTotals other) {
        return new PeriodTotals(
                sales + other.sales,
                quantity + other.quantity,
                cost + other.cost,
                count + other.count
        );
    }
}
