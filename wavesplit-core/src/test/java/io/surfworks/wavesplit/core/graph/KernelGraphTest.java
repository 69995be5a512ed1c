package io.surfworks.wavesplit.core.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.wavesplit.core.graph.WaveOps.Binary;
import io.surfworks.wavesplit.core.graph.WaveOps.Mma;
import io.surfworks.wavesplit.core.graph.WaveOps.NewRegister;
import io.surfworks.wavesplit.core.graph.WaveOps.Output;
import io.surfworks.wavesplit.core.graph.WaveOps.Read;
import io.surfworks.wavesplit.core.graph.WaveOps.Reduce;
import io.surfworks.wavesplit.core.graph.WaveOps.Write;
import io.surfworks.wavesplit.core.symbolic.IndexExpr;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;
import io.surfworks.wavesplit.core.types.AddressSpace;
import io.surfworks.wavesplit.core.types.DataType;
import io.surfworks.wavesplit.core.types.MemoryType;
import io.surfworks.wavesplit.core.types.RegisterType;

@DisplayName("KernelGraph")
class KernelGraphTest {

    private static final IndexSymbol M = IndexExpr.symbol("M");
    private static final IndexSymbol N = IndexExpr.symbol("N");
    private static final IndexSymbol K = IndexExpr.symbol("K");

    private KernelGraph graph;
    private Node a;
    private Node b;

    @BeforeEach
    void setUp() {
        graph = new KernelGraph("copy");
        a = graph.placeholder("a", MemoryType.declare(M, AddressSpace.GLOBAL_MEMORY, DataType.F16));
        b = graph.placeholder("b", MemoryType.declare(M, AddressSpace.GLOBAL_MEMORY, DataType.F16));
    }

    @Nested
    @DisplayName("structure")
    class Structure {

        @Test
        @DisplayName("tracks users on insertion")
        void tracksUsers() {
            Node read = graph.add("read", new Read(4, null), a);
            Node write = graph.add("write", new Write(4, null), read, b);

            assertEquals(List.of(read), a.users());
            assertEquals(List.of(write), read.users());
            assertEquals(List.of(read, b), write.operands());
            assertEquals(List.of(a, b, read, write), graph.nodes());
        }

        @Test
        @DisplayName("inserts after an anchor in program order")
        void insertsAfterAnchor() {
            Node read = graph.add("read", new Read(4, null), a);
            graph.add("write", new Write(4, null), read, b);

            Node copy = graph.insertAfter(read, "read_M:1", new Read(4, null), List.of(a));

            assertEquals(3, graph.nodes().indexOf(copy));
            assertEquals(copy.index(), graph.arenaSize() - 1);
            assertSame(copy, graph.node(copy.index()));
        }

        @Test
        @DisplayName("replaces operands and moves users")
        void replacesOperands() {
            Node read = graph.add("read", new Read(4, null), a);
            Node other = graph.add("read2", new Read(4, null), b);
            Node write = graph.add("write", new Write(4, null), read, b);

            graph.replaceOperands(write, List.of(other, b));

            assertFalse(read.hasUsers());
            assertEquals(List.of(write), other.users());
        }

        @Test
        @DisplayName("walks nodes matching a predicate")
        void walk() {
            graph.add("read", new Read(4, null), a);

            assertEquals(1, graph.walk(n -> n.op() instanceof Read).size());
        }
    }

    @Nested
    @DisplayName("erasure")
    class Erasure {

        @Test
        @DisplayName("refuses to erase a node with users")
        void refusesUsedNode() {
            Node read = graph.add("read", new Read(4, null), a);
            graph.add("write", new Write(4, null), read, b);

            assertThrows(IllegalStateException.class, () -> graph.erase(read));
        }

        @Test
        @DisplayName("keeps the arena slot and detaches from operands")
        void erasesUnusedNode() {
            Node read = graph.add("read", new Read(4, null), a);

            graph.erase(read);

            assertTrue(read.isErased());
            assertFalse(a.hasUsers());
            assertEquals(3, graph.arenaSize());
            assertEquals(2, graph.size());
            assertSame(read, graph.node(read.index()));
        }

        @Test
        @DisplayName("keeps program order across insertions and erasures at both ends")
        void relinksProgramOrder() {
            Node first = graph.add("r1", new Read(4, null), a);
            Node tail = graph.add("r2", new Read(4, null), b);

            graph.erase(tail);
            Node appended = graph.add("r3", new Read(4, null), b);
            Node front = graph.insertAfter(a, "r4", new Read(4, null), List.of(b));
            graph.erase(first);
            Node afterTail = graph.insertAfter(appended, "r5", new Read(4, null), List.of(a));
            Node last = graph.add("r6", new Read(4, null), a);

            assertEquals(List.of(a, front, b, appended, afterTail, last), graph.nodes());
            assertEquals(6, graph.size());
            assertFalse(graph.dump().contains("%r1 "));
        }

        @Test
        @DisplayName("handles many clones inserted after one anchor")
        void manyInsertionsAfterAnchor() {
            Node read = graph.add("read", new Read(4, null), a);
            Node anchor = read;
            for (int i = 0; i < 20_000; i++) {
                anchor = graph.insertAfter(anchor, "read_M:" + i, new Read(4, null), List.of(a));
            }
            for (Node node : graph.walk(n -> n.name().startsWith("read_M:"))) {
                graph.erase(node);
            }

            assertEquals(List.of(a, b, read), graph.nodes());
            assertEquals(20_003, graph.arenaSize());
        }

        @Test
        @DisplayName("rejects erased operands")
        void rejectsErasedOperand() {
            Node read = graph.add("read", new Read(4, null), a);
            graph.erase(read);

            assertThrows(IllegalArgumentException.class, () -> graph.add("neg", new WaveOps.Unary("neg"), read));
        }

        @Test
        @DisplayName("rejects nodes of another graph")
        void rejectsForeignNode() {
            KernelGraph other = new KernelGraph("other");
            Node foreign = other.placeholder("x", RegisterType.declare(M, DataType.F16));

            assertThrows(IllegalArgumentException.class, () -> graph.add("neg", new WaveOps.Unary("neg"), foreign));
        }
    }

    @Nested
    @DisplayName("type inference")
    class TypeInference {

        @Test
        @DisplayName("read produces a register of the memory shape")
        void readType() {
            Node read = graph.add("read", new Read(4, null), a);

            assertEquals(RegisterType.declare(M, DataType.F16), read.type());
            assertEquals(List.of(M), read.indexingDims());
        }

        @Test
        @DisplayName("binary takes the higher rank operand type")
        void binaryType() {
            Node row = graph.add("row", new NewRegister(List.of(M), DataType.F32, 0.0));
            Node tile = graph.add("tile", new NewRegister(List.of(M, N), DataType.F32, 0.0));

            Node sum = graph.add("add", new Binary("add"), row, tile);

            assertEquals(tile.type(), sum.type());
        }

        @Test
        @DisplayName("reduce drops the reduction dimension")
        void reduceType() {
            Node tile = graph.add("tile", new NewRegister(List.of(M, K), DataType.F32, 0.0));
            Node row = graph.add("row", new NewRegister(List.of(K), DataType.F32, 0.0));

            Node sum = graph.add("sum", new Reduce("sum", K, false), tile);
            Node total = graph.add("total", new Reduce("sum", K, false), row);

            assertEquals(RegisterType.declare(M, DataType.F32), sum.type());
            assertEquals(DataType.F32, total.type());
        }

        @Test
        @DisplayName("mma reduces along the lhs dimension the accumulator lacks")
        void mmaReductionDim() {
            Node lhs = graph.add("lhs", new NewRegister(List.of(M, K), DataType.F16, 0.0));
            Node rhs = graph.add("rhs", new NewRegister(List.of(N, K), DataType.F16, 0.0));
            Node acc = graph.add("acc", new NewRegister(List.of(M, N), DataType.F32, 0.0));

            Node mma = graph.add("mma", new Mma(), lhs, rhs, acc);

            assertEquals(acc.type(), mma.type());
            assertEquals(K, ((Mma) mma.op()).reductionDim(mma));
            assertEquals(List.of(M, N), mma.indexingDims());
        }

        @Test
        @DisplayName("output produces no value")
        void outputType() {
            Node read = graph.add("read", new Read(4, null), a);
            Node output = graph.add("output", new Output(), read);

            assertNull(output.type());
            assertTrue(output.op().collectsAllReplicas());
        }

        @Test
        @DisplayName("rejects wrong arity")
        void wrongArity() {
            Node read = graph.add("read", new Read(4, null), a);

            assertThrows(IllegalArgumentException.class, () -> graph.add("add", new Binary("add"), read));
        }
    }

    @Test
    @DisplayName("dumps nodes in program order")
    void dump() {
        Node read = graph.add("read", new Read(4, null), a);
        read.setExpansionMetadata(new ExpansionMetadata(DimQuery.of(Map.of(M, 1))));

        String dump = graph.dump();

        assertTrue(dump.startsWith("graph copy {"));
        assertTrue(dump.contains("%read = read(%a) : Register[M, f16] {M:1}"));
    }
}
