package br.com.analytics.pipeline.pvm_bridge_batch.model;

public final class PeriodAccumulator {

    private double sales;
    private double quantity;
    private double cost;
    private long count;

    public void add(double rowSales, double rowQuantity, double rowCost) {
        sales += rowSales;
        quantity += rowQuantity;
        cost += rowCost;
        count++;
    }

    public PeriodTotals snapshot() {
        return new PeriodTotals(sales, quantity, cost, count);
    }
}
