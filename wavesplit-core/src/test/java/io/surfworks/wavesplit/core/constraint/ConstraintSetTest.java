package io.surfworks.wavesplit.core.constraint;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.wavesplit.core.ConfigurationException;
import io.surfworks.wavesplit.core.symbolic.IndexExpr;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;

/**
 * Tests for constraint lookup and hardware constraint invariants.
 */
class ConstraintSetTest {

    private static final IndexSymbol M = IndexExpr.symbol("M");
    private static final IndexSymbol K = IndexExpr.symbol("K");

    @Test
    @DisplayName("filters constraints by kind in declaration order")
    void filtersByKind() {
        WorkgroupConstraint wg = new WorkgroupConstraint(M, IndexExpr.symbol("BLOCK_M"), 0);
        TilingConstraint tiling = new TilingConstraint(K, IndexExpr.symbol("BLOCK_K"));
        HardwareConstraint hw = new HardwareConstraint(64, 1, 1, 1);
        ConstraintSet constraints = ConstraintSet.of(wg, tiling, hw);

        assertEquals(List.of(wg), constraints.workgroupConstraints());
        assertEquals(List.of(tiling), constraints.tilingConstraints());
        assertSame(hw, constraints.hardwareConstraint());
        assertEquals(3, constraints.size());
    }

    @Test
    @DisplayName("requires exactly one hardware constraint")
    void requiresOneHardwareConstraint() {
        ConstraintSet none = ConstraintSet.of(new TilingConstraint(K, IndexExpr.constant(16)));
        ConstraintSet two = ConstraintSet.of(new HardwareConstraint(64), new HardwareConstraint(32));

        ConfigurationException e = assertThrows(ConfigurationException.class, none::hardwareConstraint);
        assertEquals("hardware", e.getSubject());
        assertThrows(ConfigurationException.class, two::hardwareConstraint);
    }

    @Test
    @DisplayName("lists aliased dimensions")
    void aliasedDims() {
        IndexSymbol m2 = IndexExpr.symbol("M2");
        ConstraintSet constraints = ConstraintSet.of(SymbolicAlias.of(m2, M), new HardwareConstraint(64));

        assertEquals(List.of(m2), constraints.aliasedDims());
    }

    @Test
    @DisplayName("hardware waves per block are validated and set once")
    void wavesPerBlockSetOnce() {
        HardwareConstraint hw = new HardwareConstraint(64);

        assertThrows(ConfigurationException.class, () -> hw.wavesPerBlock(0));
        assertThrows(IllegalArgumentException.class, () -> hw.setWavesPerBlock(new int[] {2, 1}));
        assertThrows(IllegalArgumentException.class, () -> hw.setWavesPerBlock(new int[] {2, 0, 1}));

        hw.setWavesPerBlock(new int[] {2, 2, 1});

        assertEquals(2, hw.wavesPerBlock(1));
        assertArrayEquals(new int[] {128, 2, 1}, hw.threadsPerBlock());
        assertThrows(IllegalStateException.class, () -> hw.setWavesPerBlock(new int[] {1, 1, 1}));
    }

    @Test
    @DisplayName("tile count is the ceiling of dimension over tile size")
    void tileCount() {
        WorkgroupConstraint wg = new WorkgroupConstraint(M, IndexExpr.constant(64), 0);

        assertEquals("ceiling(M/64)", wg.count().toString());
        assertEquals("$WG0", wg.workgroupIdSymbol().name());
    }
}
