package io.surfworks.wavesplit.core.types;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.surfworks.wavesplit.core.DeclarationException;
import io.surfworks.wavesplit.core.symbolic.IndexExpr;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;

/**
 * A symbolically shaped value: addressable storage ({@link MemoryType}) or a
 * virtual register value ({@link RegisterType}).
 *
 * <p>Shaped types are declared once per kernel signature and never change.
 * They are never instantiated as runtime values; they tag graph nodes.
 */
public sealed interface ShapedType extends ValueType permits MemoryType, RegisterType {

    List<IndexExpr> symbolicShape();

    DataType dtype();

    AddressSpace addressSpace();

    default int rank() {
        return symbolicShape().size();
    }

    /**
     * Returns the logical dimensions the shape is expressed over, in shape
     * order. Constant entries contribute no dimension.
     */
    default List<IndexSymbol> indexingDims() {
        return new ArrayList<>(dimToShape().keySet());
    }

    /**
     * Maps each logical dimension to the shape entry derived from it, e.g.
     * {@code K -> K/32}.
     */
    default Map<IndexSymbol, IndexExpr> dimToShape() {
        Map<IndexSymbol, IndexExpr> result = new LinkedHashMap<>();
        for (IndexExpr entry : symbolicShape()) {
            Optional<IndexSymbol> dim = entry.inferDim();
            dim.ifPresent(d -> result.putIfAbsent(d, entry));
        }
        return result;
    }

    /**
     * Converts declared shape entries to expressions, promoting integers.
     *
     * @throws DeclarationException if the shape is empty or an entry is not an expression
     */
    static List<IndexExpr> toShape(List<?> entries) {
        if (entries.isEmpty()) {
            throw new DeclarationException("Expected shape to be a non-empty sequence of IndexExpr, got " + entries);
        }
        List<IndexExpr> shape = new ArrayList<>(entries.size());
        for (Object entry : entries) {
            if (!(entry instanceof IndexExpr) && !(entry instanceof Integer) && !(entry instanceof Long)) {
                throw new DeclarationException("Expected shape to be a sequence of IndexExpr, got " + entries
                        + " (offending entry: " + entry + ")");
            }
            shape.add(IndexExpr.of(entry));
        }
        return List.copyOf(shape);
    }
}
