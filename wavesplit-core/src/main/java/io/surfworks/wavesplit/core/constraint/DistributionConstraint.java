package io.surfworks.wavesplit.core.constraint;

import io.surfworks.wavesplit.core.symbolic.IndexExpr;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;

/**
 * Constraint that distributes one logical dimension in tiles of
 * {@link #tileSize()} elements.
 */
public sealed interface DistributionConstraint extends Constraint
        permits WorkgroupConstraint, TilingConstraint, WaveConstraint {

    IndexSymbol dim();

    IndexExpr tileSize();

    /**
     * Number of tiles: {@code ceiling(dim / tileSize)}.
     */
    default IndexExpr count() {
        return dim().ceilDiv(tileSize());
    }
}
