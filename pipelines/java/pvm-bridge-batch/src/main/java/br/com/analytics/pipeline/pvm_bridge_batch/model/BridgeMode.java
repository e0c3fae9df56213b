package br.com.analytics.pipeline.pvm_bridge_batch.model;

import java.util.Locale;

public enum BridgeMode {
    PVM("pvm"),
    GM("gm");

    private final String id;

    BridgeMode(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static BridgeMode fromId(String id) {
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (BridgeMode mode : values()) {
            if (mode.id.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown bridge mode: " + id);
    }
}
