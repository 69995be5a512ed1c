package io.surfworks.wavesplit.expansion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import io.surfworks.wavesplit.core.ConfigurationException;
import io.surfworks.wavesplit.core.constraint.ConstraintSet;
import io.surfworks.wavesplit.core.graph.DimQuery;
import io.surfworks.wavesplit.core.graph.ExpansionMetadata;
import io.surfworks.wavesplit.core.graph.KernelGraph;
import io.surfworks.wavesplit.core.graph.Node;
import io.surfworks.wavesplit.core.graph.WaveOps.Mma;
import io.surfworks.wavesplit.core.graph.WaveOps.Placeholder;
import io.surfworks.wavesplit.core.graph.WaveOps.Reduce;
import io.surfworks.wavesplit.core.graph.WaveOps.Reduction;
import io.surfworks.wavesplit.core.graph.WaveOps.Reshape;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;
import io.surfworks.wavesplit.core.symbolic.IndexingContext;
import io.surfworks.wavesplit.core.types.ShapedType;

/**
 * Expands a symbolically shaped kernel graph into one clone per replica
 * coordinate.
 *
 * <p>Starting from the graph's leaves, each node is cloned once for every
 * point of the cross product of its {@link DimensionScaling} factors. Operands
 * are resolved recursively at the consumer's coordinate projected onto the
 * operand's own dimensions, so a node shared by several consumers is cloned
 * once per coordinate and reused. Kernel-signature placeholders are never
 * cloned; consumers index them directly. After expansion the superseded
 * originals and unused registers and loop arguments are removed.
 *
 * <p>Example usage:
 * <pre>{@code
 * ExpansionPass pass = new ExpansionPass(constraints, idxc);
 * pass.expand(graph);
 * System.out.println("Clones created: " + pass.lastCloneCount());
 * }</pre>
 */
public final class ExpansionPass {

    private static final Logger LOG = Logger.getLogger(ExpansionPass.class.getName());

    private final ConstraintSet constraints;
    private final IndexingContext idxc;
    private int lastCloneCount;

    public ExpansionPass(ConstraintSet constraints, IndexingContext idxc) {
        this.constraints = constraints;
        this.idxc = idxc;
    }

    /**
     * Expands {@code graph} in place.
     *
     * @return the same graph, expanded
     */
    public static KernelGraph expand(KernelGraph graph, ConstraintSet constraints, IndexingContext idxc) {
        return new ExpansionPass(constraints, idxc).expand(graph);
    }

    /**
     * Expands {@code graph} in place and runs cleanup.
     *
     * @return the same graph, expanded
     * @throws ConfigurationException if the constraints do not resolve to
     *         static scaling factors, or a consumer asks for an operand
     *         replica the operand is not split into
     */
    public KernelGraph expand(KernelGraph graph) {
        ExpansionSession session = new ExpansionSession(graph, constraints, idxc);
        // Hardware cardinality is checked even for graphs with nothing to expand.
        constraints.hardwareConstraint();

        List<Node> leaves = graph.walk(node -> !node.hasUsers());
        for (Node leaf : leaves) {
            if (leaf.op().collectsAllReplicas()) {
                rewireToReplicas(session, leaf);
            } else if (isExpandable(leaf)) {
                session.addCleanupRoot(leaf);
                for (DimQuery query : Coordinates.enumerate(expansionScaling(session, leaf))) {
                    expandAt(session, leaf, query);
                }
            }
        }

        GraphCleanup.removeOriginalNodes(graph, session.cleanupRoots(), session::isSuperseded);
        GraphCleanup.removeUnusedRegisters(graph);
        GraphCleanup.removeUnusedIterArgs(graph);

        lastCloneCount = session.cloneCount();
        LOG.fine("Expanded " + graph.name() + " into " + lastCloneCount + " clones");
        LOG.fine(graph::dump);
        return graph;
    }

    /**
     * Returns the number of clones created by the last {@link #expand(KernelGraph)}.
     */
    public int lastCloneCount() {
        return lastCloneCount;
    }

    /**
     * A node takes part in expansion unless it is a kernel-signature
     * placeholder. Loop-carried arguments do.
     */
    static boolean isExpandable(Node node) {
        return !(node.op() instanceof Placeholder);
    }

    /**
     * Returns the clone of {@code node} at {@code query}, creating it and the
     * operand clones it needs on first request.
     */
    Node expandAt(ExpansionSession session, Node node, DimQuery query) {
        if (!isExpandable(node)) {
            return node;
        }
        if (isPassThrough(node)) {
            if (node.expansionMetadata() == null) {
                node.setExpansionMetadata(ExpansionMetadata.doNotExpand());
            }
            return node;
        }

        DimQuery coordinate = coordinateOf(session, node, query);
        Node existing = session.cloneAt(node, coordinate);
        if (existing != null) {
            return existing;
        }
        requireInRange(session, node, coordinate);

        if (node.op() instanceof Mma) {
            return expandMmaChain(session, node, coordinate);
        }

        List<Node> operands;
        if (node.op() instanceof Reduce reduce) {
            operands = reduceOperands(session, node, reduce, coordinate);
        } else if (node.op() instanceof Reshape reshape) {
            operands = reshapeOperands(session, node, reshape, coordinate);
        } else {
            operands = new ArrayList<>();
            for (Node operand : node.operands()) {
                operands.add(expandAt(session, operand, coordinate));
            }
        }
        Node clone = insertClone(session, node, coordinate, operands);
        session.recordClone(node, coordinate, clone);
        return clone;
    }

    private static boolean isPassThrough(Node node) {
        if (node.op().isCoordinateIndependent()) {
            return true;
        }
        return !(node.type() instanceof ShapedType) && node.operands().isEmpty();
    }

    /**
     * Scaling restricted to the dimensions the node's clones are told apart
     * by: its indexing dimensions, in indexing order. A reduction dimension is
     * consumed inside each clone and is not among them.
     */
    private Map<IndexSymbol, Integer> expansionScaling(ExpansionSession session, Node node) {
        Map<IndexSymbol, Integer> scaling = session.scaling(node);
        Map<IndexSymbol, Integer> result = new LinkedHashMap<>();
        for (IndexSymbol dim : node.indexingDims()) {
            Integer factor = scaling.get(dim);
            if (factor != null) {
                result.put(dim, factor);
            }
        }
        if (node.op() instanceof Reduction reduction) {
            result.remove(reduction.reductionDim(node));
        }
        return result;
    }

    private DimQuery coordinateOf(ExpansionSession session, Node node, DimQuery query) {
        return query.project(expansionScaling(session, node).keySet());
    }

    /**
     * A consumer finer-grained than its operand along a dimension would ask
     * for replicas the operand does not have.
     *
     * @throws ConfigurationException naming the dimension
     */
    private void requireInRange(ExpansionSession session, Node node, DimQuery coordinate) {
        Map<IndexSymbol, Integer> scaling = expansionScaling(session, node);
        for (Map.Entry<IndexSymbol, Integer> entry : coordinate.values().entrySet()) {
            int factor = scaling.get(entry.getKey());
            if (entry.getValue() >= factor) {
                throw new ConfigurationException(entry.getKey().name(),
                        "replica " + entry.getValue() + " of " + node.name() + " requested, but it is split into "
                                + factor + "; a reshape is needed between the two granularities");
            }
        }
    }

    /**
     * Number of replicas a reduction consumes along its reduction dimension:
     * the factor its source is split into, else its own.
     */
    private static int reductionFactor(ExpansionSession session, Node node, Node source, IndexSymbol reductionDim) {
        Integer factor = session.scaling(source).get(reductionDim);
        if (factor == null) {
            factor = session.scaling(node).get(reductionDim);
        }
        return factor == null ? 1 : factor;
    }

    private List<Node> reduceOperands(ExpansionSession session, Node node, Reduce reduce, DimQuery coordinate) {
        Node source = node.operands().get(0);
        int factor = reductionFactor(session, node, source, reduce.reductionDim());
        List<Node> operands = new ArrayList<>();
        Node previous = null;
        for (int r = 0; r < factor; r++) {
            Node replica = expandAt(session, source, coordinate.with(reduce.reductionDim(), r));
            // A source that does not vary along the reduction dimension is taken once.
            if (replica != previous) {
                operands.add(replica);
            }
            previous = replica;
        }
        if (reduce.hasInit()) {
            operands.add(expandAt(session, node.operands().get(node.operands().size() - 1), coordinate));
        }
        return operands;
    }

    private List<Node> reshapeOperands(ExpansionSession session, Node node, Reshape reshape, DimQuery coordinate) {
        Node source = node.operands().get(0);
        List<DimQuery> sourceQueries =
                ReshapeQueries.sourceQueries(coordinate, session.vectorShapes(node), reshape.targetVectorShape());
        List<Node> operands = new ArrayList<>(sourceQueries.size());
        for (int i = 0; i < sourceQueries.size(); i++) {
            DimQuery sourceQuery = sourceQueries.get(i);
            boolean fresh = isExpandable(source) && !isPassThrough(source)
                    && !session.hasClone(source, coordinateOf(session, source, sourceQuery));
            Node replica = expandAt(session, source, sourceQuery);
            if (fresh) {
                replica.expansionMetadata().setReshapeSource(coordinate, sourceQueries.size(), i);
            }
            operands.add(replica);
        }
        return operands;
    }

    /**
     * Expands an mma at an output coordinate into a chain along its reduction
     * dimension: the first link accumulates into the accumulator, every later
     * link into the previous link. Consumers of the mma receive the last link.
     */
    private Node expandMmaChain(ExpansionSession session, Node node, DimQuery coordinate) {
        IndexSymbol reductionDim = ((Mma) node.op()).reductionDim(node);
        Node lhs = node.operands().get(0);
        int factor = reductionFactor(session, node, lhs, reductionDim);
        Node rhs = node.operands().get(1);
        Node accumulator = expandAt(session, node.operands().get(2), coordinate);

        Node link = null;
        for (int k = 0; k < factor; k++) {
            DimQuery linkQuery = coordinate.with(reductionDim, k);
            List<Node> operands = List.of(
                    expandAt(session, lhs, linkQuery),
                    expandAt(session, rhs, linkQuery),
                    link == null ? accumulator : link);
            link = insertClone(session, node, linkQuery, operands);
            session.recordClone(node, linkQuery, link);
        }
        link.expansionMetadata().setLastMmaNode(true);
        session.memoize(node, coordinate, link);
        return link;
    }

    private static Node insertClone(ExpansionSession session, Node node, DimQuery query, List<Node> operands) {
        Node clone = session.graph().insertAfter(session.anchor(node),
                ExpansionNaming.expandedName(node, query), node.op(), operands);
        clone.setVectorShapes(node.vectorShapes());
        clone.setExpansionMetadata(new ExpansionMetadata(query));
        return clone;
    }

    /**
     * Rewires a node that takes every replica of each operand (an output or a
     * loop) in place. The node itself is kept.
     */
    private void rewireToReplicas(ExpansionSession session, Node node) {
        List<Node> operands = new ArrayList<>();
        for (Node operand : node.operands()) {
            if (!isExpandable(operand)) {
                operands.add(operand);
                continue;
            }
            session.addCleanupRoot(operand);
            for (DimQuery query : Coordinates.enumerate(expansionScaling(session, operand))) {
                Node replica = expandAt(session, operand, query);
                if (!operands.contains(replica)) {
                    operands.add(replica);
                }
            }
        }
        session.graph().replaceOperands(node, operands);
        node.setExpansionMetadata(new ExpansionMetadata(DimQuery.EMPTY));
    }
}
