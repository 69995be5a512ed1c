package io.surfworks.wavesplit.core.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.surfworks.wavesplit.core.symbolic.IndexSymbol;

/**
 * A replica coordinate: the concrete replica index of an expanded clone along
 * each logical dimension it is expanded over, e.g. {@code {M:1, N:0}}.
 *
 * <p>Equality ignores entry order; iteration follows insertion order, which is
 * the order used for naming.
 */
public record DimQuery(Map<IndexSymbol, Integer> values) {

    public static final DimQuery EMPTY = new DimQuery(Map.of());

    public DimQuery {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static DimQuery of(Map<IndexSymbol, Integer> values) {
        return new DimQuery(values);
    }

    public Integer get(IndexSymbol dim) {
        return values.get(dim);
    }

    public boolean contains(IndexSymbol dim) {
        return values.containsKey(dim);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    /**
     * Returns a copy with one dimension set, appended if not yet present.
     */
    public DimQuery with(IndexSymbol dim, int value) {
        Map<IndexSymbol, Integer> copy = new LinkedHashMap<>(values);
        copy.put(dim, value);
        return new DimQuery(copy);
    }

    /**
     * Returns a copy with the given dimensions overridden or appended.
     */
    public DimQuery merge(DimQuery overrides) {
        Map<IndexSymbol, Integer> copy = new LinkedHashMap<>(values);
        copy.putAll(overrides.values);
        return new DimQuery(copy);
    }

    /**
     * Projects this coordinate onto the given dimensions, in their order. A
     * dimension this coordinate does not mention selects replica 0.
     */
    public DimQuery project(Collection<IndexSymbol> dims) {
        Map<IndexSymbol, Integer> projected = new LinkedHashMap<>();
        for (IndexSymbol dim : dims) {
            projected.put(dim, values.getOrDefault(dim, 0));
        }
        return new DimQuery(projected);
    }

    /**
     * Returns a copy without the given dimension.
     */
    public DimQuery without(IndexSymbol dim) {
        Map<IndexSymbol, Integer> copy = new LinkedHashMap<>(values);
        copy.remove(dim);
        return new DimQuery(copy);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<IndexSymbol, Integer> e : values.entrySet()) {
            if (!first) sb.append(", ");
            sb.append(e.getKey()).append(':').append(e.getValue());
            first = false;
        }
        return sb.append('}').toString();
    }
}
