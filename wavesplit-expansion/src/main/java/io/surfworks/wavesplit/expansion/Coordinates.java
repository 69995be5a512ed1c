package io.surfworks.wavesplit.expansion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.surfworks.wavesplit.core.graph.DimQuery;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;

/**
 * Replica coordinate enumeration.
 */
public final class Coordinates {

    private Coordinates() {}

    /**
     * Row-major strides of a scaling map: the last dimension varies fastest.
     * {@code {M:4, N:2}} gives {@code [2, 1]}.
     */
    public static int[] computeStrides(Map<IndexSymbol, Integer> scaling) {
        int[] strides = new int[scaling.size()];
        List<Integer> factors = new ArrayList<>(scaling.values());
        int stride = 1;
        for (int i = factors.size() - 1; i >= 0; i--) {
            strides[i] = stride;
            stride *= factors.get(i);
        }
        return strides;
    }

    /**
     * Enumerates every coordinate of the cross product of
     * {@code [0, factor)} per dimension, in stride order. An empty scaling
     * yields the single empty coordinate.
     */
    public static List<DimQuery> enumerate(Map<IndexSymbol, Integer> scaling) {
        int[] strides = computeStrides(scaling);
        List<IndexSymbol> dims = new ArrayList<>(scaling.keySet());
        int total = 1;
        for (int factor : scaling.values()) {
            total *= factor;
        }

        List<DimQuery> coordinates = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            Map<IndexSymbol, Integer> values = new LinkedHashMap<>();
            for (int d = 0; d < dims.size(); d++) {
                IndexSymbol dim = dims.get(d);
                values.put(dim, (i / strides[d]) % scaling.get(dim));
            }
            coordinates.add(new DimQuery(values));
        }
        return coordinates;
    }
}
