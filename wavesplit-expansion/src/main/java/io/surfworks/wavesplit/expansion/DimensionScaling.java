package io.surfworks.wavesplit.expansion;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.logging.Logger;

import io.surfworks.wavesplit.core.ConfigurationException;
import io.surfworks.wavesplit.core.constraint.Constraint;
import io.surfworks.wavesplit.core.constraint.ConstraintSet;
import io.surfworks.wavesplit.core.constraint.DistributionConstraint;
import io.surfworks.wavesplit.core.constraint.HardwareConstraint;
import io.surfworks.wavesplit.core.constraint.TilingConstraint;
import io.surfworks.wavesplit.core.constraint.WorkgroupConstraint;
import io.surfworks.wavesplit.core.graph.Node;
import io.surfworks.wavesplit.core.graph.WaveOps.Reduction;
import io.surfworks.wavesplit.core.symbolic.IndexExpr;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;
import io.surfworks.wavesplit.core.symbolic.IndexingContext;
import io.surfworks.wavesplit.core.types.ShapedType;

/**
 * Computes how many replicas each logical dimension of a node is split into.
 *
 * <p>For every workgroup or tiling constraint on a dimension the node has a
 * nonzero vector width for, the factor is
 * {@code ceiling(tileSize / (waveCount * vectorSize))}, where the wave count
 * is the hardware waves per block along the workgroup dimension (1 for
 * tiling). Dimensions without a constraint but with a static extent get
 * {@code ceiling(extent / vectorSize)}, and so does the reduction dimension of
 * a reduction.
 *
 * <pre>{@code
 * // M = 64, BLOCK_M = 8, one wave, vector width 2
 * Map<IndexSymbol, Integer> scaling = DimensionScaling.resolve(read, constraints, idxc);
 * // {M=4}
 * }</pre>
 */
public final class DimensionScaling {

    private static final Logger LOG = Logger.getLogger(DimensionScaling.class.getName());

    private DimensionScaling() {}

    /**
     * Resolves the scaling of a node from its own vector shapes, falling back
     * to the hardware constraint's.
     *
     * @return factor per dimension, in constraint order followed by the
     *         node's remaining indexing dimensions
     * @throws ConfigurationException if there is not exactly one hardware
     *         constraint or a quantity is not statically known
     */
    public static Map<IndexSymbol, Integer> resolve(Node node, ConstraintSet constraints, IndexingContext idxc) {
        HardwareConstraint hardware = constraints.hardwareConstraint();
        Map<IndexSymbol, Integer> vectorShapes = node.vectorShapes() != null
                ? node.vectorShapes()
                : hardware.vectorShapes();
        return resolve(node, vectorShapes, constraints, idxc);
    }

    /**
     * Resolves the scaling of a node against explicit vector shapes.
     */
    public static Map<IndexSymbol, Integer> resolve(Node node, Map<IndexSymbol, Integer> vectorShapes,
                                                    ConstraintSet constraints, IndexingContext idxc) {
        HardwareConstraint hardware = constraints.hardwareConstraint();
        Map<IndexSymbol, Integer> scaling = new LinkedHashMap<>();
        if (vectorShapes == null || !(node.type() instanceof ShapedType shaped)) {
            return scaling;
        }

        Map<IndexSymbol, IndexExpr> dimToShape = shaped.dimToShape();
        for (Constraint constraint : constraints) {
            if (!(constraint instanceof WorkgroupConstraint) && !(constraint instanceof TilingConstraint)) {
                continue;
            }
            DistributionConstraint distribution = (DistributionConstraint) constraint;
            IndexSymbol dim = distribution.dim();
            Integer vectorSize = vectorShapes.get(dim);
            if (vectorSize == null || vectorSize == 0) {
                continue;
            }

            // Shapes derived from the dimension (e.g. K/32) scale the tile the same way.
            IndexExpr tileExpr = distribution.tileSize();
            IndexExpr shapeEntry = dimToShape.get(dim);
            if (shapeEntry != null && !shapeEntry.equals(dim)) {
                tileExpr = shapeEntry.substitute(Map.of(dim, distribution.tileSize()));
            }
            OptionalLong tileSize = idxc.staticValue(tileExpr);
            if (tileSize.isEmpty()) {
                throw new ConfigurationException(dim.name(),
                        "tile size " + tileExpr + ", wave count and vector size must be statically known");
            }

            int waveCount = 1;
            if (constraint instanceof WorkgroupConstraint workgroup) {
                waveCount = hardware.wavesPerBlock(workgroup.workgroupDim());
            }

            long tile = tileSize.getAsLong();
            if (tile % waveCount != 0 || (tile / waveCount) % vectorSize != 0) {
                LOG.warning("Tile size is not divisible by wave count and vector size: dim=" + dim
                        + ", tileSize=" + tile + ", waveCount=" + waveCount + ", vectorSize=" + vectorSize);
            }
            scaling.put(dim, ceilDiv(tile, (long) waveCount * vectorSize));
        }

        // Dimensions with no constraint on them but a known extent.
        for (IndexSymbol dim : node.indexingDims()) {
            addStaticExtent(scaling, dim, vectorShapes, idxc);
        }
        if (node.op() instanceof Reduction reduction) {
            addStaticExtent(scaling, reduction.reductionDim(node), vectorShapes, idxc);
        }
        return scaling;
    }

    private static void addStaticExtent(Map<IndexSymbol, Integer> scaling, IndexSymbol dim,
                                        Map<IndexSymbol, Integer> vectorShapes, IndexingContext idxc) {
        Integer vectorSize = vectorShapes.get(dim);
        if (scaling.containsKey(dim) || !idxc.isStatic(dim) || vectorSize == null || vectorSize <= 0) {
            return;
        }
        scaling.put(dim, ceilDiv(idxc.requireStaticValue(dim, "extent of " + dim), vectorSize));
    }

    private static int ceilDiv(long numerator, long denominator) {
        return Math.toIntExact((numerator + denominator - 1) / denominator);
    }
}
