package io.surfworks.wavesplit.core.constraint;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.logging.Logger;

import io.surfworks.wavesplit.core.ConfigurationException;
import io.surfworks.wavesplit.core.graph.KernelGraph;
import io.surfworks.wavesplit.core.graph.Node;
import io.surfworks.wavesplit.core.graph.WaveOps.Iterate;
import io.surfworks.wavesplit.core.symbolic.IndexExpr;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;
import io.surfworks.wavesplit.core.symbolic.IndexingContext;

/**
 * One-time derivations over a kernel's constraints, run before expansion.
 *
 * <p>Populates the fields constraints leave open at declaration time
 * (tiling induction variables, wave ids, waves per block, alias bindings) and
 * derives per-loop trip counts and the launch grid.
 *
 * <pre>{@code
 * ConstraintSetup setup = new ConstraintSetup(constraints, idxc);
 * setup.initialize(graph);
 * long[] grid = setup.inferGridShape();
 * }</pre>
 */
public final class ConstraintSetup {

    private static final Logger LOG = Logger.getLogger(ConstraintSetup.class.getName());

    private static final int MAX_WORKGROUP_DIM = 2;

    private final ConstraintSet constraints;
    private final IndexingContext idxc;

    public ConstraintSetup(ConstraintSet constraints, IndexingContext idxc) {
        this.constraints = constraints;
        this.idxc = idxc;
    }

    /**
     * Runs alias binding, induction variable creation and wave constraint
     * initialization, in that order.
     */
    public void initialize(KernelGraph graph) {
        bindSymbolicAliases();
        createInductionVars(graph);
        initializeWaveConstraints();
    }

    /**
     * Creates an induction variable {@code $ARG<axis>} for every loop and binds
     * it to the tiling constraints on the loop axis.
     *
     * @return the induction variable of each loop node
     */
    public Map<Node, IndexSymbol> createInductionVars(KernelGraph graph) {
        Map<Node, IndexSymbol> inductionVars = new LinkedHashMap<>();
        for (Node loop : graph.walk(n -> n.op() instanceof Iterate)) {
            IndexSymbol axis = ((Iterate) loop.op()).axis();
            IndexSymbol var = new IndexSymbol("$ARG" + axis.name());
            inductionVars.put(loop, var);
            for (TilingConstraint tiling : constraints.tilingConstraints()) {
                if (tiling.dim().equals(axis)) {
                    tiling.setInductionVar(var);
                }
            }
        }
        return inductionVars;
    }

    /**
     * Links every wave constraint to the workgroup constraint on its dimension
     * and derives its wave id. When the hardware constraint does not declare
     * waves per block, derives them from the wave constraints.
     *
     * @throws ConfigurationException if a wave constraint has no workgroup
     *         constraint on its dimension, or its wave count is not static
     */
    public void initializeWaveConstraints() {
        HardwareConstraint hardware = constraints.hardwareConstraint();
        for (WaveConstraint wave : constraints.waveConstraints()) {
            for (WorkgroupConstraint workgroup : constraints.workgroupConstraints()) {
                if (wave.dim().equals(workgroup.dim()) && wave.workgroupConstraint() == null) {
                    wave.setWaveIdFromHardwareAndWorkgroupConstraint(hardware, workgroup);
                }
            }
        }

        if (hardware.hasWavesPerBlock()) {
            return;
        }
        int[] wavesPerBlock = {1, 1, 1};
        for (WaveConstraint wave : constraints.waveConstraints()) {
            if (wave.workgroupConstraint() == null) {
                throw new ConfigurationException(wave.dim().name(),
                        "wave constraint has no workgroup constraint on the same dimension");
            }
            int workgroupDim = wave.workgroupDim();
            if (workgroupDim >= HardwareConstraint.GRID_RANK) {
                throw new ConfigurationException(wave.dim().name(),
                        "waves can only be distributed along grid dimensions 0-2, got " + workgroupDim);
            }
            long count = idxc.requireStaticValue(wave.wavesPerBlock(), "waves per block of " + wave.dim());
            wavesPerBlock[workgroupDim] = Math.toIntExact(count);
        }
        hardware.setWavesPerBlock(wavesPerBlock);
        LOG.fine("Derived waves per block " + Arrays.toString(wavesPerBlock));
    }

    /**
     * Computes the trip count of every loop from the tiling constraint on its
     * axis. Loops without a tiling constraint are omitted.
     */
    public Map<Node, Long> tripCounts(KernelGraph graph) {
        Map<Node, Long> counts = new LinkedHashMap<>();
        for (Node loop : graph.walk(n -> n.op() instanceof Iterate)) {
            IndexSymbol axis = ((Iterate) loop.op()).axis();
            for (TilingConstraint tiling : constraints.tilingConstraints()) {
                if (tiling.dim().equals(axis)) {
                    counts.put(loop, idxc.requireStaticValue(tiling.count(), "trip count of " + axis));
                }
            }
        }
        return counts;
    }

    /**
     * Binds the source of every alias whose target is statically known.
     */
    public void bindSymbolicAliases() {
        for (SymbolicAlias alias : constraints.symbolicAliases()) {
            OptionalLong target = idxc.staticValue(alias.target());
            if (target.isPresent()) {
                long value = idxc.requireStaticValue(
                        alias.sourceValue(IndexExpr.constant(target.getAsLong())),
                        "alias " + alias.source());
                idxc.bind(alias.source(), value);
            }
        }
    }

    /**
     * Computes the launch grid from the primary, non-aliased workgroup
     * constraints. Grid dimensions 2 and above fold into dimension 2.
     */
    public long[] inferGridShape() {
        long[] grid = {1, 1, 1};
        List<IndexSymbol> aliased = constraints.aliasedDims();
        for (WorkgroupConstraint workgroup : constraints.workgroupConstraints()) {
            if (aliased.contains(workgroup.dim()) || !workgroup.primary()) {
                continue;
            }
            int d = Math.min(workgroup.workgroupDim(), MAX_WORKGROUP_DIM);
            grid[d] *= idxc.requireStaticValue(workgroup.count(), "workgroup count of " + workgroup.dim());
        }
        return grid;
    }
}
