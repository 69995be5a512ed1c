package io.surfworks.wavesplit.core.symbolic;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.LongBinaryOperator;

/**
 * Symbolic integer index expression.
 *
 * <p>Expressions are immutable values with structural equality. They cover
 * what kernel shapes and tile sizes are written with: symbols, constants,
 * sums, products, exact quotients ({@code K/32}) and floor/ceiling division.
 *
 * <pre>{@code
 * IndexSymbol k = IndexExpr.symbol("K");
 * IndexExpr half = k.div(IndexExpr.constant(2));            // K/2
 * half.substitute(Map.of(k, IndexExpr.constant(64)));        // 32
 * half.inferDim();                                           // Optional[K]
 * }</pre>
 */
public sealed interface IndexExpr permits IndexSymbol, IndexExpr.Constant, IndexExpr.Sum,
        IndexExpr.Product, IndexExpr.Quotient, IndexExpr.FloorDiv, IndexExpr.CeilDiv {

    /**
     * Returns a new expression with the given symbols replaced. Sub-expressions
     * whose operands all become constants are folded.
     */
    IndexExpr substitute(Map<IndexSymbol, ? extends IndexExpr> subs);

    /**
     * Evaluates the expression under the given bindings.
     *
     * @return the integer value, or empty if a symbol is unbound or an exact
     *         quotient does not divide evenly
     */
    OptionalLong evaluate(Map<IndexSymbol, Long> bindings);

    void collectSymbols(Set<IndexSymbol> out);

    /**
     * Returns the free symbols in first-occurrence order.
     */
    default Set<IndexSymbol> freeSymbols() {
        Set<IndexSymbol> symbols = new LinkedHashSet<>();
        collectSymbols(symbols);
        return symbols;
    }

    /**
     * Returns the logical dimension this expression is derived from, e.g.
     * {@code K} for {@code K/32}. Constant expressions have none.
     */
    default Optional<IndexSymbol> inferDim() {
        return freeSymbols().stream().findFirst();
    }

    default boolean isConstant() {
        return this instanceof Constant;
    }

    default IndexExpr plus(IndexExpr other) {
        return new Sum(List.of(this, other));
    }

    default IndexExpr times(IndexExpr other) {
        return new Product(List.of(this, other));
    }

    default IndexExpr div(IndexExpr other) {
        return new Quotient(this, other);
    }

    default IndexExpr floorDiv(IndexExpr other) {
        return new FloorDiv(this, other);
    }

    default IndexExpr ceilDiv(IndexExpr other) {
        return new CeilDiv(this, other);
    }

    static IndexSymbol symbol(String name) {
        return new IndexSymbol(name);
    }

    static Constant constant(long value) {
        return new Constant(value);
    }

    /**
     * Promotes a shape entry to an expression. Integers become constants,
     * expressions are returned unchanged.
     *
     * @throws IllegalArgumentException for any other value
     */
    static IndexExpr of(Object value) {
        if (value instanceof IndexExpr expr) {
            return expr;
        }
        if (value instanceof Integer || value instanceof Long) {
            return new Constant(((Number) value).longValue());
        }
        throw new IllegalArgumentException("Not an index expression: " + value);
    }

    // ==================== Variants ====================

    record Constant(long value) implements IndexExpr {
        @Override
        public IndexExpr substitute(Map<IndexSymbol, ? extends IndexExpr> subs) {
            return this;
        }

        @Override
        public OptionalLong evaluate(Map<IndexSymbol, Long> bindings) {
            return OptionalLong.of(value);
        }

        @Override
        public void collectSymbols(Set<IndexSymbol> out) {
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record Sum(List<IndexExpr> terms) implements IndexExpr {
        public Sum {
            terms = List.copyOf(terms);
        }

        @Override
        public IndexExpr substitute(Map<IndexSymbol, ? extends IndexExpr> subs) {
            return fold(new Sum(substituteAll(terms, subs)));
        }

        @Override
        public OptionalLong evaluate(Map<IndexSymbol, Long> bindings) {
            return reduce(terms, bindings, Math::addExact);
        }

        @Override
        public void collectSymbols(Set<IndexSymbol> out) {
            terms.forEach(t -> t.collectSymbols(out));
        }

        @Override
        public String toString() {
            return "(" + join(terms, " + ") + ")";
        }
    }

    record Product(List<IndexExpr> factors) implements IndexExpr {
        public Product {
            factors = List.copyOf(factors);
        }

        @Override
        public IndexExpr substitute(Map<IndexSymbol, ? extends IndexExpr> subs) {
            return fold(new Product(substituteAll(factors, subs)));
        }

        @Override
        public OptionalLong evaluate(Map<IndexSymbol, Long> bindings) {
            return reduce(factors, bindings, Math::multiplyExact);
        }

        @Override
        public void collectSymbols(Set<IndexSymbol> out) {
            factors.forEach(f -> f.collectSymbols(out));
        }

        @Override
        public String toString() {
            return join(factors, "*");
        }
    }

    /**
     * Exact division. Evaluates only when the divisor divides the dividend.
     */
    record Quotient(IndexExpr numerator, IndexExpr denominator) implements IndexExpr {
        @Override
        public IndexExpr substitute(Map<IndexSymbol, ? extends IndexExpr> subs) {
            return fold(new Quotient(numerator.substitute(subs), denominator.substitute(subs)));
        }

        @Override
        public OptionalLong evaluate(Map<IndexSymbol, Long> bindings) {
            OptionalLong n = numerator.evaluate(bindings);
            OptionalLong d = denominator.evaluate(bindings);
            if (n.isEmpty() || d.isEmpty() || d.getAsLong() == 0 || n.getAsLong() % d.getAsLong() != 0) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(n.getAsLong() / d.getAsLong());
        }

        @Override
        public void collectSymbols(Set<IndexSymbol> out) {
            numerator.collectSymbols(out);
            denominator.collectSymbols(out);
        }

        @Override
        public String toString() {
            return operand(numerator) + "/" + operand(denominator);
        }
    }

    record FloorDiv(IndexExpr numerator, IndexExpr denominator) implements IndexExpr {
        @Override
        public IndexExpr substitute(Map<IndexSymbol, ? extends IndexExpr> subs) {
            return fold(new FloorDiv(numerator.substitute(subs), denominator.substitute(subs)));
        }

        @Override
        public OptionalLong evaluate(Map<IndexSymbol, Long> bindings) {
            return divide(numerator, denominator, bindings, Math::floorDiv);
        }

        @Override
        public void collectSymbols(Set<IndexSymbol> out) {
            numerator.collectSymbols(out);
            denominator.collectSymbols(out);
        }

        @Override
        public String toString() {
            return "floor(" + operand(numerator) + "/" + operand(denominator) + ")";
        }
    }

    record CeilDiv(IndexExpr numerator, IndexExpr denominator) implements IndexExpr {
        @Override
        public IndexExpr substitute(Map<IndexSymbol, ? extends IndexExpr> subs) {
            return fold(new CeilDiv(numerator.substitute(subs), denominator.substitute(subs)));
        }

        @Override
        public OptionalLong evaluate(Map<IndexSymbol, Long> bindings) {
            return divide(numerator, denominator, bindings, (a, b) -> -Math.floorDiv(-a, b));
        }

        @Override
        public void collectSymbols(Set<IndexSymbol> out) {
            numerator.collectSymbols(out);
            denominator.collectSymbols(out);
        }

        @Override
        public String toString() {
            return "ceiling(" + operand(numerator) + "/" + operand(denominator) + ")";
        }
    }

    // ==================== Helpers ====================

    private static List<IndexExpr> substituteAll(List<IndexExpr> exprs, Map<IndexSymbol, ? extends IndexExpr> subs) {
        List<IndexExpr> result = new ArrayList<>(exprs.size());
        for (IndexExpr e : exprs) {
            result.add(e.substitute(subs));
        }
        return result;
    }

    private static IndexExpr fold(IndexExpr expr) {
        if (!expr.freeSymbols().isEmpty()) {
            return expr;
        }
        OptionalLong value = expr.evaluate(Map.of());
        return value.isPresent() ? new Constant(value.getAsLong()) : expr;
    }

    private static OptionalLong reduce(List<IndexExpr> exprs, Map<IndexSymbol, Long> bindings, LongBinaryOperator op) {
        Long acc = null;
        for (IndexExpr e : exprs) {
            OptionalLong v = e.evaluate(bindings);
            if (v.isEmpty()) {
                return OptionalLong.empty();
            }
            acc = acc == null ? v.getAsLong() : op.applyAsLong(acc, v.getAsLong());
        }
        return acc == null ? OptionalLong.empty() : OptionalLong.of(acc);
    }

    private static OptionalLong divide(IndexExpr numerator, IndexExpr denominator,
                                       Map<IndexSymbol, Long> bindings, LongBinaryOperator op) {
        OptionalLong n = numerator.evaluate(bindings);
        OptionalLong d = denominator.evaluate(bindings);
        if (n.isEmpty() || d.isEmpty() || d.getAsLong() == 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(op.applyAsLong(n.getAsLong(), d.getAsLong()));
    }

    private static String operand(IndexExpr e) {
        if (e instanceof IndexSymbol || e instanceof Constant || e instanceof Sum) {
            return e.toString();
        }
        return "(" + e + ")";
    }

    private static String join(List<IndexExpr> exprs, String separator) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) sb.append(separator);
            sb.append(operand(exprs.get(i)));
        }
        return sb.toString();
    }
}
