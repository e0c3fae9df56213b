package br.com.analytics.pipeline.pvm_bridge_batch.model;

public record SummaryPeriod(
        double value,
        double sales,
        double quantity,
        double cost,
        long count
) {

    public static final SummaryPeriod ZERO = new SummaryPeriod(0d, 0d, 0d, 0d, 0L);

    public SummaryPeriod plus(PeriodSnapshot snapshot) {
        return new SummaryPeriod(
                value + snapshot.value(),
                sales + snapshot.sales(),
                quantity + snapshot.volume(),
                cost + snapshot.cost(),
                count + snapshot.count()
        );
    }
}
