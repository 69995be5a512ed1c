package io.surfworks.wavesplit.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.surfworks.wavesplit.core.graph.WaveOps.Operation;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;
import io.surfworks.wavesplit.core.types.ValueType;

/**
 * A node in a {@link KernelGraph}.
 *
 * <p>Nodes live in the graph's arena and keep their index for the lifetime of
 * the graph, erased or not. Structure (operands, users, erasure) is changed
 * only through the owning graph.
 */
public final class Node {

    private final int index;
    private final String name;
    private final Operation op;
    private final ValueType type;
    private final List<Node> operands;
    private final List<Node> users = new ArrayList<>();
    private Map<IndexSymbol, Integer> vectorShapes;
    private ExpansionMetadata expansionMetadata;
    private boolean erased;

    // Program-order links, maintained by the owning graph.
    Node prev;
    Node next;

    Node(int index, String name, Operation op, ValueType type, List<Node> operands) {
        this.index = index;
        this.name = name;
        this.op = op;
        this.type = type;
        this.operands = new ArrayList<>(operands);
    }

    public int index() {
        return index;
    }

    public String name() {
        return name;
    }

    public Operation op() {
        return op;
    }

    /**
     * Returns the result type, or null if the node produces no value.
     */
    public ValueType type() {
        return type;
    }

    public List<Node> operands() {
        return Collections.unmodifiableList(operands);
    }

    public List<Node> users() {
        return Collections.unmodifiableList(users);
    }

    public boolean hasUsers() {
        return !users.isEmpty();
    }

    public List<IndexSymbol> indexingDims() {
        return op.indexingDims(this);
    }

    /**
     * Returns the per-dimension vector width, or null if none was assigned.
     */
    public Map<IndexSymbol, Integer> vectorShapes() {
        return vectorShapes;
    }

    public Node setVectorShapes(Map<IndexSymbol, Integer> vectorShapes) {
        this.vectorShapes = vectorShapes == null ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(vectorShapes));
        return this;
    }

    public ExpansionMetadata expansionMetadata() {
        return expansionMetadata;
    }

    public void setExpansionMetadata(ExpansionMetadata expansionMetadata) {
        this.expansionMetadata = expansionMetadata;
    }

    public boolean isErased() {
        return erased;
    }

    void markErased() {
        erased = true;
    }

    List<Node> mutableOperands() {
        return operands;
    }

    List<Node> mutableUsers() {
        return users;
    }

    /**
     * Renders the node as {@code %name = op(%a, %b) : type}.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append('%').append(name).append(" = ").append(op.opName()).append('(');
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append('%').append(operands.get(i).name());
        }
        sb.append(')');
        if (type != null) {
            sb.append(" : ").append(type);
        }
        if (expansionMetadata != null && !expansionMetadata.dimQuery().isEmpty()) {
            sb.append(' ').append(expansionMetadata.dimQuery());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Node[" + index + ":" + name + "]";
    }
}
