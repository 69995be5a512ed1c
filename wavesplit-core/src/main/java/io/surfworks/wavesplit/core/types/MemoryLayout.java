package io.surfworks.wavesplit.core.types;

import java.util.List;

import io.surfworks.wavesplit.core.DeclarationException;
import io.surfworks.wavesplit.core.symbolic.IndexExpr;

/**
 * Physical shape of a buffer whose storage layout differs from its logical
 * symbolic shape.
 */
public record MemoryLayout(List<IndexExpr> shape) {

    public MemoryLayout {
        if (shape == null || shape.isEmpty()) {
            throw new DeclarationException("Physical layout must have at least one dimension");
        }
        shape = List.copyOf(shape);
    }

    public static MemoryLayout of(Object... shape) {
        return new MemoryLayout(ShapedType.toShape(List.of(shape)));
    }
}
