package br.com.analytics.pipeline.pvm_bridge_batch.model;

import java.util.Locale;

/**
 * Unit value used as "price" in gross-margin mode.
 */
public enum PriceDefinition {
    /** Value is sales minus cost. */
    MARGIN_PER_UNIT("margin-per-unit"),
    /** Value is sales; cost becomes its own bridge component. */
    SALES_PER_UNIT("sales-per-unit");

    private final String id;

    PriceDefinition(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static PriceDefinition fromId(String id) {
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (PriceDefinition definition : values()) {
            if (definition.id.equals(normalized)) {
                return definition;
            }
        }
        throw new IllegalArgumentException("Unknown price definition: " + id);
    }
}
