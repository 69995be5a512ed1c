package io.surfworks.wavesplit.core.mapping;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.surfworks.wavesplit.core.DeclarationException;
import io.surfworks.wavesplit.core.symbolic.IndexExpr;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;

/**
 * Coordinate transform between an iteration domain and the input/output
 * coordinate spaces of a gather/scatter style memory access.
 *
 * <p>The iteration domain has {@code numIterators} synthesized iterators
 * {@code $index0 .. $indexN-1}. Each input and output coordinate symbol maps to
 * an expression over those iterators. The size of every iterator is inferred
 * from the coordinate it is mapped to verbatim:
 * <pre>{@code
 * IndexSymbol i = IndexMapping.iterator(0);
 * IndexSymbol j = IndexMapping.iterator(1);
 * IndexMapping transpose = new IndexMapping(2,
 *         ordered(M, i, N, j),     // inputs
 *         ordered(N, j, M, i));    // outputs
 * transpose.iterationShape();      // [M, N]
 * transpose.isInputIdentity();     // true
 * transpose.isOutputIdentity();    // false
 * }</pre>
 *
 * <p>Coordinate order is the iteration order of the maps passed in, so callers
 * should pass ordered maps. Instances are immutable; {@link #substitute(Map)}
 * returns a new mapping.
 */
public final class IndexMapping {

    private final Map<IndexSymbol, Integer> iters;
    private final List<IndexSymbol> iterationShape;
    private final Map<IndexSymbol, IndexExpr> inputMapping;
    private final Map<IndexSymbol, IndexExpr> outputMapping;
    private final List<Map<IndexSymbol, IndexExpr>> dynamicValMappings;
    private final Map<IndexSymbol, Integer> dynamicValIndices;

    public IndexMapping(int numIterators,
                        Map<IndexSymbol, ? extends IndexExpr> inputs,
                        Map<IndexSymbol, ? extends IndexExpr> outputs) {
        this(numIterators, inputs, outputs, List.of());
    }

    public IndexMapping(int numIterators,
                        Map<IndexSymbol, ? extends IndexExpr> inputs,
                        Map<IndexSymbol, ? extends IndexExpr> outputs,
                        Map<IndexSymbol, ? extends IndexExpr> dynamicValMapping) {
        this(numIterators, inputs, outputs, singletonOrEmpty(dynamicValMapping));
    }

    /**
     * Creates a mapping and infers the iteration shape.
     *
     * @throws DeclarationException if two different coordinates claim the same
     *         iterator, or an iterator never appears verbatim in either mapping
     */
    public IndexMapping(int numIterators,
                        Map<IndexSymbol, ? extends IndexExpr> inputs,
                        Map<IndexSymbol, ? extends IndexExpr> outputs,
                        List<? extends Map<IndexSymbol, ? extends IndexExpr>> dynamicValMappings) {
        Map<IndexSymbol, Integer> iterMap = new LinkedHashMap<>();
        for (int i = 0; i < numIterators; i++) {
            iterMap.put(iterator(i), i);
        }

        IndexSymbol[] shape = new IndexSymbol[numIterators];
        Map<IndexSymbol, Integer> claimed = new HashMap<>();
        unify(iterMap, shape, claimed, inputs);
        unify(iterMap, shape, claimed, outputs);
        for (IndexSymbol size : shape) {
            if (size == null) {
                throw new DeclarationException("Cannot determine iteration domain: iterationShape="
                        + Arrays.toString(shape));
            }
        }

        this.iters = Collections.unmodifiableMap(iterMap);
        this.iterationShape = List.of(shape);
        this.inputMapping = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        this.outputMapping = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));

        List<Map<IndexSymbol, IndexExpr>> dynVals = new ArrayList<>();
        Map<IndexSymbol, Integer> dynIndices = new LinkedHashMap<>();
        for (Map<IndexSymbol, ? extends IndexExpr> m : dynamicValMappings) {
            dynIndices.put(dynamicVal(dynVals.size()), dynVals.size());
            dynVals.add(Collections.unmodifiableMap(new LinkedHashMap<>(m)));
        }
        this.dynamicValMappings = List.copyOf(dynVals);
        this.dynamicValIndices = Collections.unmodifiableMap(dynIndices);
    }

    private static List<Map<IndexSymbol, ? extends IndexExpr>> singletonOrEmpty(
            Map<IndexSymbol, ? extends IndexExpr> mapping) {
        List<Map<IndexSymbol, ? extends IndexExpr>> result = new ArrayList<>();
        if (!mapping.isEmpty()) {
            result.add(mapping);
        }
        return result;
    }

    /**
     * Assigns each iterator the coordinate it appears verbatim under. Iterators
     * and their size symbols must correspond one to one.
     */
    private static void unify(Map<IndexSymbol, Integer> iterMap, IndexSymbol[] shape,
                              Map<IndexSymbol, Integer> claimed, Map<IndexSymbol, ? extends IndexExpr> mapping) {
        for (Map.Entry<IndexSymbol, ? extends IndexExpr> entry : mapping.entrySet()) {
            Integer i = entry.getValue() instanceof IndexSymbol s ? iterMap.get(s) : null;
            if (i == null) {
                continue;
            }
            IndexSymbol current = shape[i];
            if (current != null && !current.equals(entry.getKey())) {
                throw new DeclarationException("Iterator conflict: " + current + " and " + entry.getKey());
            }
            Integer other = claimed.putIfAbsent(entry.getKey(), i);
            if (other != null && other.intValue() != i.intValue()) {
                throw new DeclarationException("Iterator conflict: " + entry.getKey() + " claimed by "
                        + iterator(other) + " and " + iterator(i));
            }
            shape[i] = entry.getKey();
        }
    }

    /**
     * Returns the synthesized iterator symbol {@code $index<index>}.
     */
    public static IndexSymbol iterator(int index) {
        return new IndexSymbol("$index" + index);
    }

    /**
     * Returns the synthesized dynamic value symbol {@code $dynamic_val<index>}.
     */
    public static IndexSymbol dynamicVal(int index) {
        return new IndexSymbol("$dynamic_val" + index);
    }

    public int numIterators() {
        return iters.size();
    }

    public int numDynamicVals() {
        return dynamicValIndices.size();
    }

    public Map<IndexSymbol, Integer> iters() {
        return iters;
    }

    public List<IndexSymbol> iterationShape() {
        return iterationShape;
    }

    public Map<IndexSymbol, IndexExpr> inputMapping() {
        return inputMapping;
    }

    public Map<IndexSymbol, IndexExpr> outputMapping() {
        return outputMapping;
    }

    public List<Map<IndexSymbol, IndexExpr>> dynamicValMappings() {
        return dynamicValMappings;
    }

    public Map<IndexSymbol, Integer> dynamicValIndices() {
        return dynamicValIndices;
    }

    public List<IndexSymbol> inputShape() {
        return List.copyOf(inputMapping.keySet());
    }

    public List<IndexSymbol> outputShape() {
        return List.copyOf(outputMapping.keySet());
    }

    /**
     * Returns a new mapping with symbols replaced in every mapped expression,
     * including the dynamic value mappings.
     */
    public IndexMapping substitute(Map<IndexSymbol, ? extends IndexExpr> subs) {
        List<Map<IndexSymbol, IndexExpr>> dynVals = new ArrayList<>();
        for (Map<IndexSymbol, IndexExpr> m : dynamicValMappings) {
            dynVals.add(substitute(m, subs));
        }
        return new IndexMapping(numIterators(), substitute(inputMapping, subs),
                substitute(outputMapping, subs), dynVals);
    }

    private static Map<IndexSymbol, IndexExpr> substitute(Map<IndexSymbol, IndexExpr> mapping,
                                                          Map<IndexSymbol, ? extends IndexExpr> subs) {
        Map<IndexSymbol, IndexExpr> result = new LinkedHashMap<>();
        mapping.forEach((key, value) -> result.put(key, value.substitute(subs)));
        return result;
    }

    public List<IndexExpr> mapInputIndices() {
        return List.copyOf(inputMapping.values());
    }

    /**
     * Returns the input expressions in the given coordinate order.
     *
     * @throws IllegalArgumentException if a symbol is not an input coordinate
     */
    public List<IndexExpr> mapInputIndices(List<IndexSymbol> symbols) {
        return mapIndices(inputMapping, symbols);
    }

    public List<IndexExpr> mapOutputIndices() {
        return List.copyOf(outputMapping.values());
    }

    /**
     * Returns the output expressions in the given coordinate order.
     *
     * @throws IllegalArgumentException if a symbol is not an output coordinate
     */
    public List<IndexExpr> mapOutputIndices(List<IndexSymbol> symbols) {
        return mapIndices(outputMapping, symbols);
    }

    private static List<IndexExpr> mapIndices(Map<IndexSymbol, IndexExpr> mapping, List<IndexSymbol> symbols) {
        List<IndexExpr> result = new ArrayList<>(symbols.size());
        for (IndexSymbol sym : symbols) {
            IndexExpr expr = mapping.get(sym);
            if (expr == null) {
                throw new IllegalArgumentException("Symbol " + sym + " is not mapped, expected one of " + mapping.keySet());
            }
            result.add(expr);
        }
        return result;
    }

    public boolean isInputIdentity() {
        return isIdentityMapping(inputMapping);
    }

    public boolean isOutputIdentity() {
        return isIdentityMapping(outputMapping);
    }

    public boolean isIdentity() {
        return isInputIdentity() && isOutputIdentity();
    }

    private boolean isIdentityMapping(Map<IndexSymbol, IndexExpr> mapping) {
        if (iters.size() != mapping.size()) {
            return false;
        }
        Iterator<IndexExpr> values = mapping.values().iterator();
        for (IndexSymbol it : iters.keySet()) {
            if (!it.equals(values.next())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndexMapping that)) return false;
        return iters.equals(that.iters)
                && inputMapping.equals(that.inputMapping)
                && outputMapping.equals(that.outputMapping)
                && dynamicValMappings.equals(that.dynamicValMappings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(iters, inputMapping, outputMapping, dynamicValMappings);
    }

    @Override
    public String toString() {
        return "IndexMapping(iters=" + iters + ", input_mapping=" + inputMapping
                + ", output_mapping=" + outputMapping + ", dynamic_val_mappings=" + dynamicValMappings + ")";
    }
}
