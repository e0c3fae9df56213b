package br.com.analytics.pipeline.pvm_bridge_batch.model;

import java.util.List;

public record Methodology(
        String title,
        String description,
        List<Formula> formulas,
        List<String> notes
) {

    public Methodology {
        formulas = List.copyOf(formulas);
        notes = List.copyOf(notes);
    }

    public record Formula(
            String name,
            String formula
    ) {
    }
}
