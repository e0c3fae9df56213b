package br.com.analytics.pipeline.pvm_bridge_batch.bridge;

import br.com.analytics.pipeline.pvm_bridge_batch.model.BridgeBucketResult;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Sorting and searching over a bridge's per-bucket results. Inputs are never modified.
 */
public final class BridgeResults {

    private BridgeResults() {
    }

    public static List<BridgeBucketResult> sort(List<BridgeBucketResult> detail, @Nullable BridgeSortOrder order) {
        return sort(detail, order, false);
    }

    /**
     * Orders by the absolute value of the chosen field, largest first unless {@code ascending}. A null
     * order keeps the input order.
     */
    public static List<BridgeBucketResult> sort(List<BridgeBucketResult> detail, @Nullable BridgeSortOrder order,
                                                boolean ascending) {
        List<BridgeBucketResult> sorted = new ArrayList<>(detail);
        if (order == null) {
            return sorted;
        }
        Comparator<BridgeBucketResult> comparator = Comparator.comparingDouble(order::magnitude);
        sorted.sort(ascending ? comparator : comparator.reversed());
        return sorted;
    }

    /**
     * Keeps results with a dimension value containing {@code term}, ignoring case. A blank term
     * keeps everything.
     */
    public static List<BridgeBucketResult> filter(List<BridgeBucketResult> detail, @Nullable String term) {
        if (term == null || term.isBlank()) {
            return new ArrayList<>(detail);
        }
        String needle = term.trim().toLowerCase(Locale.ROOT);
        List<BridgeBucketResult> matches = new ArrayList<>();
        for (BridgeBucketResult result : detail) {
            for (String value : result.dimensions().values()) {
                if (value.toLowerCase(Locale.ROOT).contains(needle)) {
                    matches.add(result);
                    break;
                }
            }
        }
        return matches;
    }
}
