package io.surfworks.wavesplit.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.surfworks.wavesplit.core.mapping.IndexMapping;
import io.surfworks.wavesplit.core.symbolic.IndexExpr;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;
import io.surfworks.wavesplit.core.types.DataType;
import io.surfworks.wavesplit.core.types.MemoryType;
import io.surfworks.wavesplit.core.types.RegisterType;
import io.surfworks.wavesplit.core.types.ShapedType;
import io.surfworks.wavesplit.core.types.ValueType;

/**
 * Operation variants of the kernel graph.
 *
 * Operations hold only their attributes; operands live on the {@link Node}.
 */
public final class WaveOps {

    private WaveOps() {}

    // ==================== Capabilities ====================

    /**
     * Base interface for all graph operations.
     */
    public sealed interface Operation permits
            Placeholder, IterArg, Allocate, NewRegister, MemoryAccess,
            Binary, Unary, Reduction, Reshape, Iterate, Output {

        String opName();

        /**
         * Computes the result type from the operands, or null for operations
         * that produce no value.
         */
        ValueType inferType(List<Node> operands);

        /**
         * Logical dimensions the node is indexed by.
         */
        default List<IndexSymbol> indexingDims(Node self) {
            return self.type() instanceof ShapedType shaped ? shaped.indexingDims() : List.of();
        }

        /**
         * True if the node means the same thing at every replica coordinate and
         * is shared by all clones of its consumers.
         */
        default boolean isCoordinateIndependent() {
            return false;
        }

        /**
         * True if the node is kept as a single instance that takes every replica
         * of each operand.
         */
        default boolean collectsAllReplicas() {
            return false;
        }
    }

    /**
     * Operations that access a buffer.
     */
    public sealed interface MemoryAccess extends Operation permits Read, Write {

        int memoryOperandIndex();

        default Node memory(Node self) {
            return self.operands().get(memoryOperandIndex());
        }
    }

    /**
     * Operations that reduce along one dimension of their operands.
     */
    public sealed interface Reduction extends Operation permits Reduce, Mma {

        IndexSymbol reductionDim(Node self);
    }

    // ==================== Leaves ====================

    /**
     * Kernel signature argument.
     */
    public record Placeholder(ValueType type) implements Operation {
        @Override
        public String opName() { return "placeholder"; }

        @Override
        public ValueType inferType(List<Node> operands) { return type; }
    }

    /**
     * Loop-carried value entering the body of an {@link Iterate} each iteration.
     */
    public record IterArg(ValueType type, int iterIndex) implements Operation {
        @Override
        public String opName() { return "iter_arg"; }

        @Override
        public ValueType inferType(List<Node> operands) { return type; }
    }

    /**
     * Buffer allocation, typically in shared memory.
     */
    public record Allocate(MemoryType type) implements Operation {
        @Override
        public String opName() { return "allocate"; }

        @Override
        public ValueType inferType(List<Node> operands) { return type; }

        @Override
        public boolean isCoordinateIndependent() { return true; }
    }

    /**
     * Creates a virtual register filled with a constant.
     */
    public record NewRegister(List<IndexExpr> shape, DataType dtype, double value) implements Operation {
        public NewRegister {
            shape = List.copyOf(shape);
        }

        @Override
        public String opName() { return "register"; }

        @Override
        public ValueType inferType(List<Node> operands) { return new RegisterType(shape, dtype); }
    }

    // ==================== Memory ====================

    /**
     * Reads from memory into registers. Operands: {@code [memory]}.
     */
    public record Read(int elementsPerThread, IndexMapping mapping) implements MemoryAccess {
        @Override
        public String opName() { return "read"; }

        @Override
        public int memoryOperandIndex() { return 0; }

        @Override
        public ValueType inferType(List<Node> operands) {
            ShapedType memory = shaped(operands, 0, this);
            if (mapping != null) {
                return new RegisterType(new ArrayList<IndexExpr>(mapping.outputShape()), memory.dtype());
            }
            return new RegisterType(memory.symbolicShape(), memory.dtype());
        }
    }

    /**
     * Writes registers to memory. Operands: {@code [value, memory]}.
     */
    public record Write(int elementsPerThread, IndexMapping mapping) implements MemoryAccess {
        @Override
        public String opName() { return "write"; }

        @Override
        public int memoryOperandIndex() { return 1; }

        @Override
        public ValueType inferType(List<Node> operands) {
            return shaped(operands, 1, this);
        }

        @Override
        public List<IndexSymbol> indexingDims(Node self) {
            if (mapping != null) {
                return mapping.inputShape();
            }
            return MemoryAccess.super.indexingDims(self);
        }
    }

    // ==================== Arithmetic ====================

    /**
     * Element-wise binary operation; the result takes the higher-rank operand type.
     */
    public record Binary(String kind) implements Operation {
        @Override
        public String opName() { return kind; }

        @Override
        public ValueType inferType(List<Node> operands) {
            requireArity(operands, 2, this);
            ValueType lhs = operands.get(0).type();
            ValueType rhs = operands.get(1).type();
            if (rhs instanceof ShapedType r && (!(lhs instanceof ShapedType l) || r.rank() > l.rank())) {
                return rhs;
            }
            return lhs;
        }
    }

    /**
     * Element-wise unary operation.
     */
    public record Unary(String kind) implements Operation {
        @Override
        public String opName() { return kind; }

        @Override
        public ValueType inferType(List<Node> operands) {
            requireArity(operands, 1, this);
            return operands.get(0).type();
        }
    }

    /**
     * Matrix multiply-accumulate. Operands: {@code [lhs, rhs, acc]}; the
     * reduction dimension is the lhs dimension the accumulator lacks.
     */
    public record Mma() implements Reduction {
        @Override
        public String opName() { return "mma"; }

        @Override
        public ValueType inferType(List<Node> operands) {
            requireArity(operands, 3, this);
            return shaped(operands, 2, this);
        }

        @Override
        public IndexSymbol reductionDim(Node self) {
            List<IndexSymbol> accDims = self.operands().get(2).indexingDims();
            for (IndexSymbol dim : self.operands().get(0).indexingDims()) {
                if (!accDims.contains(dim)) {
                    return dim;
                }
            }
            throw new IllegalStateException("mma " + self.name() + " has no reduction dimension");
        }
    }

    /**
     * Reduction along one dimension. Operands: {@code [source..., init?]}.
     * Before expansion there is a single source; clones take one source per
     * replica of the reduction dimension.
     */
    public record Reduce(String kind, IndexSymbol reductionDim, boolean hasInit) implements Reduction {
        @Override
        public String opName() { return kind; }

        @Override
        public IndexSymbol reductionDim(Node self) { return reductionDim; }

        @Override
        public ValueType inferType(List<Node> operands) {
            ShapedType source = shaped(operands, 0, this);
            List<IndexExpr> shape = new ArrayList<>();
            for (IndexExpr entry : source.symbolicShape()) {
                if (!entry.inferDim().map(reductionDim::equals).orElse(false)) {
                    shape.add(entry);
                }
            }
            if (shape.isEmpty()) {
                return source.dtype();
            }
            return new RegisterType(shape, source.dtype());
        }
    }

    /**
     * Changes the expansion granularity of a value. The reshape is expanded at
     * its own vector shape; {@code targetVectorShape} is the granularity its
     * operand is expanded at.
     */
    public record Reshape(Map<IndexSymbol, Integer> targetVectorShape) implements Operation {
        public Reshape {
            targetVectorShape = Collections.unmodifiableMap(new LinkedHashMap<>(targetVectorShape));
        }

        @Override
        public String opName() { return "reshape"; }

        @Override
        public ValueType inferType(List<Node> operands) {
            if (operands.isEmpty()) {
                throw new IllegalArgumentException("reshape needs at least one argument");
            }
            return operands.get(0).type();
        }
    }

    // ==================== Structure ====================

    /**
     * Loop over {@code axis}. Operands are the initial values of its
     * loop-carried arguments.
     */
    public record Iterate(IndexSymbol axis) implements Operation {
        @Override
        public String opName() { return "iterate"; }

        @Override
        public ValueType inferType(List<Node> operands) { return null; }

        @Override
        public boolean collectsAllReplicas() { return true; }
    }

    /**
     * Values returned by the graph.
     */
    public record Output() implements Operation {
        @Override
        public String opName() { return "output"; }

        @Override
        public ValueType inferType(List<Node> operands) { return null; }

        @Override
        public boolean collectsAllReplicas() { return true; }
    }

    // ==================== Helpers ====================

    private static ShapedType shaped(List<Node> operands, int index, Operation op) {
        if (operands.size() <= index) {
            throw new IllegalArgumentException(op.opName() + " expects an operand at position " + index);
        }
        Node operand = operands.get(index);
        if (!(operand.type() instanceof ShapedType shaped)) {
            throw new IllegalArgumentException(op.opName() + " operand " + operand.name()
                    + " must be shaped, got " + operand.type());
        }
        return shaped;
    }

    private static void requireArity(List<Node> operands, int arity, Operation op) {
        if (operands.size() != arity) {
            throw new IllegalArgumentException(op.opName() + " expects " + arity
                    + " operands, got " + operands.size());
        }
    }
}
