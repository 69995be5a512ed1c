package io.surfworks.wavesplit.core.constraint;

import java.util.Objects;

import io.surfworks.wavesplit.core.symbolic.IndexExpr;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;

/**
 * Tiles {@code dim} sequentially, {@code tileSize} elements per loop
 * iteration. The induction variable of the loop is bound once during setup.
 */
public final class TilingConstraint implements DistributionConstraint {

    private final IndexSymbol dim;
    private final IndexExpr tileSize;
    private IndexSymbol inductionVar;

    public TilingConstraint(IndexSymbol dim, IndexExpr tileSize) {
        this.dim = Objects.requireNonNull(dim, "dim");
        this.tileSize = Objects.requireNonNull(tileSize, "tileSize");
    }

    @Override
    public IndexSymbol dim() {
        return dim;
    }

    @Override
    public IndexExpr tileSize() {
        return tileSize;
    }

    /**
     * Returns the loop induction variable, or null before setup.
     */
    public IndexSymbol inductionVar() {
        return inductionVar;
    }

    /**
     * @throws IllegalStateException if a different induction variable is already bound
     */
    public void setInductionVar(IndexSymbol inductionVar) {
        if (this.inductionVar != null && !this.inductionVar.equals(inductionVar)) {
            throw new IllegalStateException("Tiling constraint on " + dim
                    + " already has induction variable " + this.inductionVar);
        }
        this.inductionVar = inductionVar;
    }

    @Override
    public String toString() {
        return "TilingConstraint[dim=" + dim + ", tileSize=" + tileSize
                + (inductionVar != null ? ", inductionVar=" + inductionVar : "") + "]";
    }
}
