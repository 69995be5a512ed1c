package io.surfworks.wavesplit.expansion;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.surfworks.wavesplit.core.constraint.ConstraintSet;
import io.surfworks.wavesplit.core.graph.DimQuery;
import io.surfworks.wavesplit.core.graph.KernelGraph;
import io.surfworks.wavesplit.core.graph.Node;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;
import io.surfworks.wavesplit.core.symbolic.IndexingContext;

/**
 * State of one expansion run.
 *
 * <p>Holds the clone memo keyed by {@code (node index, coordinate)}, the
 * per-node scaling cache, the insertion anchor of each node's clones, and the
 * originals superseded by clones. A session lives for exactly one
 * {@link ExpansionPass#expand(KernelGraph)} call.
 */
final class ExpansionSession {

    record CloneKey(int nodeIndex, DimQuery query) {}

    private final KernelGraph graph;
    private final ConstraintSet constraints;
    private final IndexingContext idxc;
    private final Map<CloneKey, Node> clones = new HashMap<>();
    private final Map<Integer, Map<IndexSymbol, Integer>> scalings = new HashMap<>();
    private final Map<Integer, Node> anchors = new HashMap<>();
    private final Set<Integer> superseded = new HashSet<>();
    private final List<Node> cleanupRoots = new ArrayList<>();
    private int cloneCount;

    ExpansionSession(KernelGraph graph, ConstraintSet constraints, IndexingContext idxc) {
        this.graph = graph;
        this.constraints = constraints;
        this.idxc = idxc;
    }

    KernelGraph graph() {
        return graph;
    }

    /**
     * Returns the node's scaling, resolved once per session.
     */
    Map<IndexSymbol, Integer> scaling(Node node) {
        Map<IndexSymbol, Integer> cached = scalings.get(node.index());
        if (cached == null) {
            cached = DimensionScaling.resolve(node, constraints, idxc);
            scalings.put(node.index(), cached);
        }
        return cached;
    }

    /**
     * Returns the node's vector shapes, falling back to the hardware's.
     */
    Map<IndexSymbol, Integer> vectorShapes(Node node) {
        if (node.vectorShapes() != null) {
            return node.vectorShapes();
        }
        Map<IndexSymbol, Integer> hardware = constraints.hardwareConstraint().vectorShapes();
        return hardware != null ? hardware : Map.of();
    }

    Node cloneAt(Node node, DimQuery query) {
        return clones.get(new CloneKey(node.index(), query));
    }

    boolean hasClone(Node node, DimQuery query) {
        return clones.containsKey(new CloneKey(node.index(), query));
    }

    /**
     * Records a clone of {@code original} and makes it the anchor the next
     * clone is inserted after.
     */
    void recordClone(Node original, DimQuery query, Node clone) {
        clones.put(new CloneKey(original.index(), query), clone);
        anchors.put(original.index(), clone);
        superseded.add(original.index());
        cloneCount++;
    }

    void memoize(Node original, DimQuery query, Node clone) {
        clones.put(new CloneKey(original.index(), query), clone);
    }

    Node anchor(Node original) {
        return anchors.getOrDefault(original.index(), original);
    }

    boolean isSuperseded(Node node) {
        return superseded.contains(node.index());
    }

    void addCleanupRoot(Node node) {
        cleanupRoots.add(node);
    }

    List<Node> cleanupRoots() {
        return cleanupRoots;
    }

    int cloneCount() {
        return cloneCount;
    }
}
