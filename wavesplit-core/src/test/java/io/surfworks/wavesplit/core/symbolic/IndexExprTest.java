package io.surfworks.wavesplit.core.symbolic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("IndexExpr")
class IndexExprTest {

    private static final IndexSymbol K = IndexExpr.symbol("K");
    private static final IndexSymbol M = IndexExpr.symbol("M");
    private static final IndexSymbol BLOCK_K = IndexExpr.symbol("BLOCK_K");

    @Nested
    @DisplayName("substitution")
    class Substitution {

        @Test
        @DisplayName("folds fully constant expressions")
        void foldsConstants() {
            IndexExpr quotient = K.div(IndexExpr.constant(32));

            IndexExpr result = quotient.substitute(Map.of(K, IndexExpr.constant(64)));

            assertEquals(IndexExpr.constant(2), result);
            assertTrue(result.isConstant());
        }

        @Test
        @DisplayName("replaces a dimension by its tile size")
        void replacesDimensionWithTileSize() {
            IndexExpr quotient = K.div(IndexExpr.constant(32));

            IndexExpr tiled = quotient.substitute(Map.of(K, BLOCK_K));

            assertEquals("BLOCK_K/32", tiled.toString());
            assertEquals(Optional.of(BLOCK_K), tiled.inferDim());
        }

        @Test
        @DisplayName("keeps inexact quotients symbolic")
        void keepsInexactQuotient() {
            IndexExpr quotient = IndexExpr.constant(7).div(IndexExpr.constant(2));

            assertEquals(OptionalLong.empty(), quotient.evaluate(Map.of()));
            assertFalse(quotient.substitute(Map.of()).isConstant());
        }
    }

    @Nested
    @DisplayName("evaluation")
    class Evaluation {

        @Test
        @DisplayName("evaluates floor and ceiling division")
        void floorAndCeiling() {
            Map<IndexSymbol, Long> bindings = Map.of(M, 10L);

            assertEquals(OptionalLong.of(2), M.floorDiv(IndexExpr.constant(4)).evaluate(bindings));
            assertEquals(OptionalLong.of(3), M.ceilDiv(IndexExpr.constant(4)).evaluate(bindings));
        }

        @Test
        @DisplayName("sums and products")
        void sumsAndProducts() {
            Map<IndexSymbol, Long> bindings = Map.of(M, 3L, K, 5L);

            assertEquals(OptionalLong.of(8), M.plus(K).evaluate(bindings));
            assertEquals(OptionalLong.of(15), M.times(K).evaluate(bindings));
        }

        @Test
        @DisplayName("unbound symbols evaluate to empty")
        void unboundSymbol() {
            assertEquals(OptionalLong.empty(), M.plus(K).evaluate(Map.of(M, 1L)));
        }

        @Test
        @DisplayName("division by zero evaluates to empty")
        void divisionByZero() {
            assertEquals(OptionalLong.empty(), M.ceilDiv(IndexExpr.constant(0)).evaluate(Map.of(M, 4L)));
        }
    }

    @Test
    @DisplayName("free symbols keep first occurrence order")
    void freeSymbolsOrder() {
        IndexExpr expr = K.times(M).plus(K);

        assertEquals(List.of(K, M), List.copyOf(expr.freeSymbols()));
        assertEquals(Optional.of(K), expr.inferDim());
        assertEquals(Optional.empty(), IndexExpr.constant(4).inferDim());
    }

    @Test
    @DisplayName("renders readable forms")
    void rendering() {
        assertEquals("(M + 1)", M.plus(IndexExpr.constant(1)).toString());
        assertEquals("M*2", M.times(IndexExpr.constant(2)).toString());
        assertEquals("ceiling(M/4)", M.ceilDiv(IndexExpr.constant(4)).toString());
        assertEquals("floor(M/4)", M.floorDiv(IndexExpr.constant(4)).toString());
    }

    @Test
    @DisplayName("promotes integers and rejects other values")
    void promotion() {
        assertEquals(IndexExpr.constant(5), IndexExpr.of(5));
        assertEquals(IndexExpr.constant(5), IndexExpr.of(5L));
        assertEquals(M, IndexExpr.of(M));
        assertThrows(IllegalArgumentException.class, () -> IndexExpr.of("M"));
    }

    @Test
    @DisplayName("rejects blank symbol names")
    void blankSymbol() {
        assertThrows(IllegalArgumentException.class, () -> new IndexSymbol(" "));
    }
}
