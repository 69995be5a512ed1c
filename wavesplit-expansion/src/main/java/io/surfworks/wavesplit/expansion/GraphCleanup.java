package io.surfworks.wavesplit.expansion;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.logging.Logger;

import io.surfworks.wavesplit.core.graph.KernelGraph;
import io.surfworks.wavesplit.core.graph.Node;
import io.surfworks.wavesplit.core.graph.WaveOps.IterArg;
import io.surfworks.wavesplit.core.graph.WaveOps.NewRegister;

/**
 * Dead-node removal after expansion. Each step only looks at user counts and
 * erasure, so the steps can run in any order once all clones exist.
 */
public final class GraphCleanup {

    private static final Logger LOG = Logger.getLogger(GraphCleanup.class.getName());

    private GraphCleanup() {}

    /**
     * Walks backward from {@code roots} through operands and erases every
     * node accepted by {@code erasable} once it has no users left. The walk
     * continues into the operands of nodes it does not erase, and skips nodes
     * already erased.
     *
     * @return the number of nodes erased
     */
    public static int removeOriginalNodes(KernelGraph graph, Collection<Node> roots, Predicate<Node> erasable) {
        Deque<Node> worklist = new ArrayDeque<>(roots);
        Set<Integer> visited = new HashSet<>();
        int erased = 0;
        while (!worklist.isEmpty()) {
            Node node = worklist.poll();
            if (node.isErased()) {
                continue;
            }
            List<Node> operands = List.copyOf(node.operands());
            boolean erase = !node.hasUsers() && erasable.test(node);
            if (erase) {
                graph.erase(node);
                erased++;
            }
            // Operands are revisited when one of their users goes away.
            if (visited.add(node.index()) || erase) {
                worklist.addAll(operands);
            }
        }
        LOG.fine("Removed " + erased + " original nodes from " + graph.name());
        return erased;
    }

    /**
     * Erases register creations with no users.
     */
    public static int removeUnusedRegisters(KernelGraph graph) {
        int erased = 0;
        for (Node node : graph.walk(n -> n.op() instanceof NewRegister)) {
            if (!node.hasUsers()) {
                graph.erase(node);
                erased++;
            }
        }
        return erased;
    }

    /**
     * Erases loop-carried arguments with no users.
     */
    public static int removeUnusedIterArgs(KernelGraph graph) {
        int erased = 0;
        for (Node node : graph.walk(n -> n.op() instanceof IterArg)) {
            if (!node.hasUsers()) {
                graph.erase(node);
                erased++;
            }
        }
        return erased;
    }
}
