package br.com.analytics.pipeline.pvm_bridge_batch.bridge;

import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeOptions;
import br.com.analytics.pipeline.pvm_bridge_batch.model.Methodology;
import br.com.analytics.pipeline.pvm_bridge_batch.model.Methodology.Formula;

import java.util.List;

/**
 * Human-readable formulas behind each bridge variant, for the assumptions sheet of an export.
 */
public final class MethodologyCatalog {

    private static final String NEW_ITEMS_NOTE = "New items (no PY data): Entire change attributed to Volume";
    private static final String DISCONTINUED_NOTE = "Discontinued items (no CY data): Entire change attributed to Volume";

    private MethodologyCatalog() {
    }

    public static Methodology describe(BridgeOptions options) {
        return switch (options.mode()) {
            case PVM -> new Methodology(
                    "Sales PVM Bridge",
                    "Decomposes revenue change into Price, Volume, and Mix components.",
                    List.of(
                            new Formula("Average Price", "Sales / Quantity"),
                            new Formula("Price Impact", "(CY Price − PY Price) × PY Volume"),
                            new Formula("Volume Impact", "(CY Volume − PY Volume) × PY Price"),
                            new Formula("Mix Impact", "Total Change − Price Impact − Volume Impact")),
                    List.of(
                            NEW_ITEMS_NOTE,
                            DISCONTINUED_NOTE,
                            "Mix Impact captures both product mix shifts and the interaction between price and volume changes",
                            "The three components sum exactly to the total revenue change"));
            case GM -> switch (options.priceDefinition()) {
                case MARGIN_PER_UNIT -> new Methodology(
                        "Gross Margin Bridge (Margin per Unit)",
                        "Analyzes drivers of gross margin change using margin per unit as the price metric.",
                        List.of(
                                new Formula("Margin per Unit (Price)", "(Sales − Cost) / Quantity"),
                                new Formula("Price Impact", "(CY Margin/Unit − PY Margin/Unit) × PY Volume"),
                                new Formula("Volume Impact", "(CY Volume − PY Volume) × PY Margin/Unit"),
                                new Formula("Mix Impact", "Total Change − Price Impact − Volume Impact")),
                        List.of(
                                NEW_ITEMS_NOTE,
                                DISCONTINUED_NOTE,
                                "Mix Impact captures the interaction effect and ensures exact reconciliation"));
                case SALES_PER_UNIT -> new Methodology(
                        "Gross Margin Bridge (Sales per Unit)",
                        "Analyzes drivers of gross margin change with cost impact shown separately.",
                        List.of(
                                new Formula("Sales per Unit (Price)", "Sales / Quantity"),
                                new Formula("Price Impact", "(CY Price − PY Price) × PY Volume"),
                                new Formula("Volume Impact", "(CY Volume − PY Volume) × PY Price"),
                                new Formula("Mix Impact", "Sales Change − Price Impact − Volume Impact"),
                                new Formula("Cost Impact", "−(CY Cost − PY Cost)")),
                        List.of(
                                NEW_ITEMS_NOTE,
                                DISCONTINUED_NOTE,
                                "Cost Impact is shown separately from the PVM decomposition"));
            };
        };
    }
}
