package io.surfworks.wavesplit.core.constraint;

import io.surfworks.wavesplit.core.symbolic.IndexExpr;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;

/**
 * Distributes {@code dim} over workgroups along grid dimension
 * {@code workgroupDim}, {@code tileSize} elements per workgroup.
 *
 * @param primary false for secondary constraints that share a grid dimension
 *                with a primary one and do not contribute to the grid shape
 */
public record WorkgroupConstraint(IndexSymbol dim, IndexExpr tileSize, int workgroupDim, boolean primary)
        implements DistributionConstraint {

    public WorkgroupConstraint {
        if (workgroupDim < 0) {
            throw new IllegalArgumentException("workgroupDim must be non-negative, got " + workgroupDim);
        }
    }

    public WorkgroupConstraint(IndexSymbol dim, IndexExpr tileSize, int workgroupDim) {
        this(dim, tileSize, workgroupDim, true);
    }

    /**
     * Returns the workgroup id symbol {@code $WG<workgroupDim>}.
     */
    public IndexSymbol workgroupIdSymbol() {
        return new IndexSymbol("$WG" + workgroupDim);
    }
}
