package io.surfworks.wavesplit.expansion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.wavesplit.core.ConfigurationException;
import io.surfworks.wavesplit.core.constraint.ConstraintSet;
import io.surfworks.wavesplit.core.constraint.HardwareConstraint;
import io.surfworks.wavesplit.core.constraint.TilingConstraint;
import io.surfworks.wavesplit.core.constraint.WorkgroupConstraint;
import io.surfworks.wavesplit.core.graph.KernelGraph;
import io.surfworks.wavesplit.core.graph.Node;
import io.surfworks.wavesplit.core.graph.WaveOps.NewRegister;
import io.surfworks.wavesplit.core.graph.WaveOps.Read;
import io.surfworks.wavesplit.core.graph.WaveOps.Reduce;
import io.surfworks.wavesplit.core.symbolic.IndexExpr;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;
import io.surfworks.wavesplit.core.symbolic.IndexingContext;
import io.surfworks.wavesplit.core.types.AddressSpace;
import io.surfworks.wavesplit.core.types.DataType;
import io.surfworks.wavesplit.core.types.MemoryType;

@DisplayName("DimensionScaling")
class DimensionScalingTest {

    private static final IndexSymbol M = IndexExpr.symbol("M");
    private static final IndexSymbol N = IndexExpr.symbol("N");
    private static final IndexSymbol K = IndexExpr.symbol("K");
    private static final IndexSymbol BLOCK_M = IndexExpr.symbol("BLOCK_M");
    private static final IndexSymbol BLOCK_K = IndexExpr.symbol("BLOCK_K");

    private KernelGraph graph;
    private IndexingContext idxc;

    @BeforeEach
    void setUp() {
        graph = new KernelGraph("scaling");
        idxc = IndexingContext.of(Map.of(M, 128, N, 96, K, 256, BLOCK_M, 64, BLOCK_K, 32));
    }

    private Node register(Map<IndexSymbol, Integer> vectorShapes, IndexExpr... shape) {
        return graph.add("reg", new NewRegister(List.of(shape), DataType.F32, 0.0)).setVectorShapes(vectorShapes);
    }

    @Nested
    @DisplayName("constrained dimensions")
    class Constrained {

        @Test
        @DisplayName("factor is ceiling of tile over waves times vector width")
        void factorFormula() {
            int[][] cases = {
                    // tile, waves, vector, expected
                    {8, 1, 2, 4},
                    {64, 2, 16, 2},
                    {64, 4, 16, 1},
                    {48, 1, 32, 2},
                    {16, 1, 64, 1},
            };
            for (int[] c : cases) {
                KernelGraph g = new KernelGraph("case");
                Node node = g.add("reg", new NewRegister(List.of(M), DataType.F16, 0.0))
                        .setVectorShapes(Map.of(M, c[2]));
                ConstraintSet constraints = ConstraintSet.of(
                        new WorkgroupConstraint(M, IndexExpr.constant(c[0]), 0),
                        new HardwareConstraint(64, c[1], 1, 1));

                Map<IndexSymbol, Integer> scaling = DimensionScaling.resolve(node, constraints, new IndexingContext());

                assertEquals(c[3], scaling.get(M), "tile=" + c[0] + " waves=" + c[1] + " vector=" + c[2]);
                assertTrue(scaling.get(M) >= 1);
            }
        }

        @Test
        @DisplayName("tiling constraints use a wave count of one")
        void tilingIgnoresWaves() {
            Node node = register(Map.of(M, 16, K, 16), M, K);
            ConstraintSet constraints = ConstraintSet.of(
                    new WorkgroupConstraint(M, BLOCK_M, 0),
                    new TilingConstraint(K, BLOCK_K),
                    new HardwareConstraint(64, 2, 1, 1));

            Map<IndexSymbol, Integer> scaling = DimensionScaling.resolve(node, constraints, idxc);

            assertEquals(Map.of(M, 2, K, 2), scaling);
            assertEquals(List.of(M, K), List.copyOf(scaling.keySet()));
        }

        @Test
        @DisplayName("derived shape entries scale the tile size")
        void derivedShapeEntry() {
            Node node = register(Map.of(K, 1), K.div(IndexExpr.constant(8)));
            ConstraintSet constraints = ConstraintSet.of(
                    new TilingConstraint(K, BLOCK_K),
                    new HardwareConstraint(64, 1, 1, 1));

            Map<IndexSymbol, Integer> scaling = DimensionScaling.resolve(node, constraints, idxc);

            // BLOCK_K/8 = 4 elements per tile
            assertEquals(4, scaling.get(K));
        }

        @Test
        @DisplayName("zero vector width marks a batch dimension")
        void zeroVectorWidth() {
            Node node = register(Map.of(M, 0, N, 32), M, N);
            ConstraintSet constraints = ConstraintSet.of(
                    new WorkgroupConstraint(M, BLOCK_M, 0),
                    new HardwareConstraint(64, 1, 1, 1));

            Map<IndexSymbol, Integer> scaling = DimensionScaling.resolve(node, constraints, idxc);

            assertEquals(Map.of(N, 3), scaling);
        }

        @Test
        @DisplayName("non-divisible tiles round up")
        void nonDivisibleRoundsUp() {
            Node node = register(Map.of(M, 24), M);
            ConstraintSet constraints = ConstraintSet.of(
                    new WorkgroupConstraint(M, BLOCK_M, 0),
                    new HardwareConstraint(64, 1, 1, 1));

            assertEquals(3, DimensionScaling.resolve(node, constraints, idxc).get(M));
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("require exactly one hardware constraint")
        void requiresHardware() {
            Node node = register(Map.of(M, 16), M);

            assertThrows(ConfigurationException.class, () -> DimensionScaling.resolve(node,
                    ConstraintSet.of(new WorkgroupConstraint(M, BLOCK_M, 0)), idxc));
            assertThrows(ConfigurationException.class, () -> DimensionScaling.resolve(node,
                    ConstraintSet.of(new HardwareConstraint(64, 1, 1, 1), new HardwareConstraint(64, 1, 1, 1)), idxc));
        }

        @Test
        @DisplayName("require a static tile size")
        void requiresStaticTile() {
            Node node = register(Map.of(M, 16), M);
            ConstraintSet constraints = ConstraintSet.of(
                    new WorkgroupConstraint(M, IndexExpr.symbol("BLOCK_X"), 0),
                    new HardwareConstraint(64, 1, 1, 1));

            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> DimensionScaling.resolve(node, constraints, idxc));
            assertEquals("M", e.getSubject());
        }

        @Test
        @DisplayName("require known waves per block")
        void requiresWavesPerBlock() {
            Node node = register(Map.of(M, 16), M);
            ConstraintSet constraints = ConstraintSet.of(
                    new WorkgroupConstraint(M, BLOCK_M, 0),
                    new HardwareConstraint(64));

            assertThrows(ConfigurationException.class, () -> DimensionScaling.resolve(node, constraints, idxc));
        }
    }

    @Test
    @DisplayName("unconstrained static dimensions scale by their extent")
    void unconstrainedStaticDimension() {
        Node node = register(Map.of(M, 16, N, 32), M, N);
        ConstraintSet constraints = ConstraintSet.of(
                new WorkgroupConstraint(M, BLOCK_M, 0),
                new HardwareConstraint(64, 1, 1, 1));

        Map<IndexSymbol, Integer> scaling = DimensionScaling.resolve(node, constraints, idxc);

        assertEquals(Map.of(M, 4, N, 3), scaling);
    }

    @Test
    @DisplayName("reductions also scale their reduction dimension")
    void reductionDimension() {
        Node source = register(Map.of(M, 16, K, 64), M, K);
        Node sum = graph.add("sum", new Reduce("sum", K, false), source).setVectorShapes(Map.of(M, 16, K, 64));
        ConstraintSet constraints = ConstraintSet.of(
                new WorkgroupConstraint(M, BLOCK_M, 0),
                new HardwareConstraint(64, 1, 1, 1));

        Map<IndexSymbol, Integer> scaling = DimensionScaling.resolve(sum, constraints, idxc);

        assertEquals(Map.of(M, 4, K, 4), scaling);
    }

    @Test
    @DisplayName("falls back to hardware vector shapes")
    void hardwareVectorShapes() {
        Node a = graph.placeholder("a", MemoryType.declare(M, AddressSpace.GLOBAL_MEMORY, DataType.F16));
        Node read = graph.add("read", new Read(4, null), a);
        ConstraintSet constraints = ConstraintSet.of(
                new WorkgroupConstraint(M, BLOCK_M, 0),
                new HardwareConstraint(64, new int[] {1, 1, 1}, Map.of(M, 32)));

        assertEquals(Map.of(M, 2), DimensionScaling.resolve(read, constraints, idxc));
    }

    @Test
    @DisplayName("value typed nodes and nodes without vector shapes do not scale")
    void emptyScaling() {
        Node row = register(Map.of(K, 16), K);
        Node total = graph.add("total", new Reduce("sum", K, false), row).setVectorShapes(Map.of(K, 16));
        Node bare = graph.add("bare", new NewRegister(List.of(M), DataType.F32, 0.0));
        ConstraintSet constraints = ConstraintSet.of(
                new TilingConstraint(K, BLOCK_K),
                new HardwareConstraint(64, 1, 1, 1));

        assertTrue(DimensionScaling.resolve(total, constraints, idxc).isEmpty());
        assertTrue(DimensionScaling.resolve(bare, constraints, idxc).isEmpty());
    }
}
