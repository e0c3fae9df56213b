package br.com.analytics.pipeline.pvm_bridge_batch.config;

import org.jspecify.annotations.Nullable;

import java.util.List;

public record ColumnMapping(
        String dateColumn,
        String salesColumn,
        String quantityColumn,
        @Nullable String costColumn,
        List<String> dimensionColumns
) {

    public ColumnMapping {
        requireColumn(dateColumn, "date");
        requireColumn(salesColumn, "sales");
        requireColumn(quantityColumn, "quantity");
        if (costColumn != null && costColumn.isBlank()) {
            costColumn = null;
        }
        dimensionColumns = dimensionColumns == null ? List.of() : List.copyOf(dimensionColumns);
    }

    public boolean hasCost() {
        return costColumn != null;
    }

    private static void requireColumn(@Nullable String column, String role) {
        if (column == null || column.isBlank()) {
            throw new ConfigurationException("Missing required column mapping: " + role);
        }
    }
}
