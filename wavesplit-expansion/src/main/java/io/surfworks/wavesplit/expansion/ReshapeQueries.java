package io.surfworks.wavesplit.expansion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.surfworks.wavesplit.core.graph.DimQuery;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;

/**
 * Maps a reshape coordinate to the operand coordinates it is assembled from.
 *
 * <p>Per dimension, with the reshape's own vector width {@code s} and its
 * target width {@code t} (the width its operand is expanded at):
 * <ul>
 *   <li>{@code s < t}: one operand replica serves {@code t/s} reshape
 *       replicas, so reshape coordinate {@code v} reads operand
 *       {@code v / (t/s)};</li>
 *   <li>{@code s > t}: a reshape replica concatenates {@code s/t} operand
 *       replicas, {@code [v*(s/t), v*(s/t) + s/t)}.</li>
 * </ul>
 * A reshape at {@code m=8, n=2} over an operand at {@code m=4, n=4} therefore
 * reads operands {@code {m:2, n:0}} and {@code {m:3, n:0}} for its coordinate
 * {@code {m:1, n:1}}.
 */
public final class ReshapeQueries {

    private ReshapeQueries() {}

    /**
     * Returns the operand coordinates for one reshape coordinate, as the cross
     * product of the per-dimension operand values in coordinate order.
     * Dimensions without a target width map one to one.
     */
    public static List<DimQuery> sourceQueries(DimQuery target,
                                               Map<IndexSymbol, Integer> sourceVectorShape,
                                               Map<IndexSymbol, Integer> targetVectorShape) {
        Map<IndexSymbol, List<Integer>> combinations = new LinkedHashMap<>();
        for (Map.Entry<IndexSymbol, Integer> entry : target.values().entrySet()) {
            IndexSymbol dim = entry.getKey();
            int value = entry.getValue();
            Integer s = sourceVectorShape.get(dim);
            Integer t = targetVectorShape.get(dim);
            if (s == null || t == null || s == 0 || t == 0) {
                combinations.put(dim, List.of(value));
            } else if (s < t) {
                combinations.put(dim, List.of(value / (t / s)));
            } else {
                int scale = s / t;
                List<Integer> range = new ArrayList<>(scale);
                for (int i = 0; i < scale; i++) {
                    range.add(value * scale + i);
                }
                combinations.put(dim, range);
            }
        }

        Map<IndexSymbol, Integer> counts = new LinkedHashMap<>();
        combinations.forEach((dim, values) -> counts.put(dim, values.size()));
        List<DimQuery> queries = new ArrayList<>();
        for (DimQuery pick : Coordinates.enumerate(counts)) {
            Map<IndexSymbol, Integer> values = new LinkedHashMap<>();
            combinations.forEach((dim, options) -> values.put(dim, options.get(pick.get(dim))));
            queries.add(new DimQuery(values));
        }
        return queries;
    }
}
