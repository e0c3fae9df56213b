package br.com.analytics.pipeline.pvm_bridge_batch.period;

import java.util.List;

public record PeriodValidation(
        List<String> warnings,
        List<String> errors
) {

    public PeriodValidation {
        warnings = List.copyOf(warnings);
        errors = List.copyOf(errors);
    }

    public boolean valid() {
        return errors.isEmpty();
    }
}
