package br.com.analytics.pipeline.pvm_bridge_batch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * {@code pvm.bridge.*} settings of the batch job. Dates are ISO {@code yyyy-MM-dd}.
 */
@ConfigurationProperties(prefix = "pvm.bridge")
public record BridgeProperties(
        @DefaultValue Input input,
        @DefaultValue Columns columns,
        @DefaultValue("auto") String dateFormat,
        @DefaultValue("12") int fiscalYearEndMonth,
        @DefaultValue Periods periods,
        @DefaultValue("pvm") String mode,
        @DefaultValue("margin-per-unit") String priceDefinition
) {

    public record Input(
            String location,
            @DefaultValue("1048576") int chunkSize,
            @DefaultValue("100") int progressInterval,
            @DefaultValue(",") String delimiter,
            @DefaultValue("UTF-8") String charset
    ) {
    }

    public record Columns(
            String date,
            String sales,
            String quantity,
            String cost,
            @DefaultValue List<String> dimensions
    ) {
    }

    public record Periods(
            String pyStart,
            String pyEnd,
            String cyStart,
            String cyEnd,
            String ltmEndDate,
            Integer cyFiscalYear,
            @DefaultValue List<Integer> fiscalYears
    ) {
    }
}
