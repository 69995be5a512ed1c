package io.surfworks.wavesplit.core.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

import io.surfworks.wavesplit.core.graph.WaveOps.Operation;
import io.surfworks.wavesplit.core.graph.WaveOps.Placeholder;
import io.surfworks.wavesplit.core.types.ValueType;

/**
 * Dataflow graph of a wave kernel.
 *
 * <p>Nodes are held in an arena and addressed by stable indices; erased nodes
 * keep their slot. Live nodes are linked in program order, so insertion next
 * to an anchor and erasure take constant time. User lists are maintained on
 * every structural change, so consumer counts are always current.
 *
 * <p>Example:
 * <pre>{@code
 * KernelGraph graph = new KernelGraph("copy");
 * Node a = graph.placeholder("a", aType);
 * Node b = graph.placeholder("b", bType);
 * Node read = graph.add("read", new Read(4, null), a);
 * graph.add("write", new Write(4, null), read, b);
 * }</pre>
 *
 * <p>Not thread-safe.
 */
public final class KernelGraph {

    private final String name;
    private final List<Node> arena = new ArrayList<>();
    private Node first;
    private Node last;
    private int size;

    public KernelGraph(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public Node placeholder(String nodeName, ValueType type) {
        return add(nodeName, new Placeholder(type));
    }

    /**
     * Appends a node at the end of the program order.
     */
    public Node add(String nodeName, Operation op, Node... operands) {
        return add(nodeName, op, Arrays.asList(operands));
    }

    public Node add(String nodeName, Operation op, List<Node> operands) {
        Node node = create(nodeName, op, operands);
        link(last, node);
        return node;
    }

    /**
     * Inserts a node directly after {@code anchor} in program order.
     */
    public Node insertAfter(Node anchor, String nodeName, Operation op, List<Node> operands) {
        requireLive(anchor);
        Node node = create(nodeName, op, operands);
        link(anchor, node);
        return node;
    }

    private Node create(String nodeName, Operation op, List<Node> operands) {
        for (Node operand : operands) {
            requireLive(operand);
        }
        ValueType type = op.inferType(operands);
        Node node = new Node(arena.size(), nodeName, op, type, operands);
        arena.add(node);
        for (Node operand : operands) {
            operand.mutableUsers().add(node);
        }
        return node;
    }

    /**
     * Returns the node with the given arena index, erased or not.
     */
    public Node node(int index) {
        return arena.get(index);
    }

    /**
     * Returns the live nodes in program order.
     */
    public List<Node> nodes() {
        return walk(node -> true);
    }

    public List<Node> walk(Predicate<Node> filter) {
        List<Node> result = new ArrayList<>();
        for (Node node = first; node != null; node = node.next) {
            if (filter.test(node)) {
                result.add(node);
            }
        }
        return result;
    }

    public int size() {
        return size;
    }

    public int arenaSize() {
        return arena.size();
    }

    /**
     * Replaces all operands of a node.
     */
    public void replaceOperands(Node node, List<Node> newOperands) {
        requireLive(node);
        for (Node operand : newOperands) {
            requireLive(operand);
        }
        for (Node old : node.mutableOperands()) {
            old.mutableUsers().remove(node);
        }
        node.mutableOperands().clear();
        node.mutableOperands().addAll(newOperands);
        for (Node operand : newOperands) {
            operand.mutableUsers().add(node);
        }
    }

    /**
     * Erases a node that has no remaining users.
     *
     * @throws IllegalStateException if the node still has users
     */
    public void erase(Node node) {
        requireLive(node);
        if (node.hasUsers()) {
            throw new IllegalStateException("Cannot erase " + node.name() + ", still used by " + node.users());
        }
        for (Node operand : node.mutableOperands()) {
            operand.mutableUsers().remove(node);
        }
        node.markErased();
        unlink(node);
    }

    // ==================== Program order ====================

    private void link(Node after, Node node) {
        Node before = after == null ? first : after.next;
        node.prev = after;
        node.next = before;
        if (after == null) {
            first = node;
        } else {
            after.next = node;
        }
        if (before == null) {
            last = node;
        } else {
            before.prev = node;
        }
        size++;
    }

    private void unlink(Node node) {
        if (node.prev == null) {
            first = node.next;
        } else {
            node.prev.next = node.next;
        }
        if (node.next == null) {
            last = node.prev;
        } else {
            node.next.prev = node.prev;
        }
        node.prev = null;
        node.next = null;
        size--;
    }

    private void requireLive(Node node) {
        if (node.index() >= arena.size() || arena.get(node.index()) != node) {
            throw new IllegalArgumentException(node + " does not belong to graph " + name);
        }
        if (node.isErased()) {
            throw new IllegalArgumentException(node + " has been erased");
        }
    }

    /**
     * Renders the live nodes in program order, one per line.
     */
    public String dump() {
        StringBuilder sb = new StringBuilder("graph ").append(name).append(" {\n");
        for (Node node = first; node != null; node = node.next) {
            sb.append("  ").append(node.format()).append('\n');
        }
        return sb.append('}').toString();
    }

    @Override
    public String toString() {
        return String.format("KernelGraph[%s, nodes=%d, arena=%d]", name, size, arena.size());
    }
}
