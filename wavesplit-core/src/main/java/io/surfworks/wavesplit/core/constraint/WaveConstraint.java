package io.surfworks.wavesplit.core.constraint;

import java.util.Objects;

import io.surfworks.wavesplit.core.symbolic.IndexExpr;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;

/**
 * Distributes the workgroup tile of {@code dim} over waves, {@code tileSize}
 * elements per wave. The wave id is derived once during setup from the
 * workgroup constraint on the same dimension.
 */
public final class WaveConstraint implements DistributionConstraint {

    private final IndexSymbol dim;
    private final IndexExpr tileSize;
    private IndexExpr waveId;
    private WorkgroupConstraint workgroupConstraint;

    public WaveConstraint(IndexSymbol dim, IndexExpr tileSize) {
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
     * Returns the wave id expression, or null before setup.
     */
    public IndexExpr waveId() {
        return waveId;
    }

    public WorkgroupConstraint workgroupConstraint() {
        return workgroupConstraint;
    }

    /**
     * Links this constraint to the workgroup constraint on the same dimension
     * and derives the wave id: {@code floor($T0 / threadsPerWave)} along grid
     * dimension 0, {@code $T<d>} otherwise.
     *
     * @throws IllegalArgumentException if the workgroup constraint is on another dimension
     * @throws IllegalStateException if the wave id was already derived
     */
    public void setWaveIdFromHardwareAndWorkgroupConstraint(HardwareConstraint hardware,
                                                           WorkgroupConstraint workgroup) {
        if (!dim.equals(workgroup.dim())) {
            throw new IllegalArgumentException("Wave constraint on " + dim
                    + " cannot be linked to workgroup constraint on " + workgroup.dim());
        }
        if (waveId != null) {
            throw new IllegalStateException("Wave id for " + dim + " already set to " + waveId);
        }
        IndexExpr threadId = HardwareConstraint.threadIdSymbol(workgroup.workgroupDim());
        if (workgroup.workgroupDim() == 0) {
            threadId = threadId.floorDiv(IndexExpr.constant(hardware.threadsPerWave()));
        }
        this.waveId = threadId;
        this.workgroupConstraint = workgroup;
    }

    /**
     * Grid dimension of the linked workgroup constraint.
     *
     * @throws IllegalStateException before setup
     */
    public int workgroupDim() {
        return requireLinked().workgroupDim();
    }

    /**
     * Waves along this dimension per workgroup: workgroup tile over wave tile.
     *
     * @throws IllegalStateException before setup
     */
    public IndexExpr wavesPerBlock() {
        return requireLinked().tileSize().div(tileSize);
    }

    private WorkgroupConstraint requireLinked() {
        if (workgroupConstraint == null) {
            throw new IllegalStateException("Wave constraint on " + dim + " is not linked to a workgroup constraint");
        }
        return workgroupConstraint;
    }

    @Override
    public String toString() {
        return "WaveConstraint[dim=" + dim + ", tileSize=" + tileSize
                + (waveId != null ? ", waveId=" + waveId : "") + "]";
    }
}
