package br.com.analytics.pipeline.pvm_bridge_batch.model;

public enum PeriodMode {
    TWO_PERIOD,
    MULTI_YEAR
}
