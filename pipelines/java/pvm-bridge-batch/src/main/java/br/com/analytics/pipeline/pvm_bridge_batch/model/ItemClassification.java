package br.com.analytics.pipeline.pvm_bridge_batch.model;

public enum ItemClassification {
    NEW,
    DISCONTINUED,
    CONTINUING
}
