package io.surfworks.wavesplit.core.symbolic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

import io.surfworks.wavesplit.core.ConfigurationException;

/**
 * Static symbol bindings of one kernel compilation, e.g. {@code M = 1024},
 * {@code BLOCK_M = 64}.
 *
 * <p>The context is owned by the compilation that created it and is handed
 * explicitly to every stage that resolves symbolic quantities.
 */
public final class IndexingContext {

    private final Map<IndexSymbol, Long> subs = new LinkedHashMap<>();

    public IndexingContext() {
    }

    /**
     * Creates a context pre-populated with the given bindings.
     */
    public static IndexingContext of(Map<IndexSymbol, ? extends Number> bindings) {
        IndexingContext ctx = new IndexingContext();
        bindings.forEach((symbol, value) -> ctx.bind(symbol, value.longValue()));
        return ctx;
    }

    /**
     * Binds a symbol to a static value.
     *
     * @return this context for chaining
     * @throws ConfigurationException if the symbol is already bound to a different value
     */
    public IndexingContext bind(IndexSymbol symbol, long value) {
        Long previous = subs.putIfAbsent(symbol, value);
        if (previous != null && previous != value) {
            throw new ConfigurationException(symbol.name(),
                    "already bound to " + previous + ", cannot rebind to " + value);
        }
        return this;
    }

    public boolean isStatic(IndexSymbol symbol) {
        return subs.containsKey(symbol);
    }

    public OptionalLong staticValue(IndexExpr expr) {
        return expr.evaluate(subs);
    }

    /**
     * Resolves an expression that must be known at compile time.
     *
     * @param expr the expression to resolve
     * @param what description of the quantity, used in the error message
     * @throws ConfigurationException if the expression does not resolve to an integer
     */
    public long requireStaticValue(IndexExpr expr, String what) {
        OptionalLong value = staticValue(expr);
        if (value.isEmpty()) {
            throw new ConfigurationException(expr.toString(), what + " must be statically known");
        }
        return value.getAsLong();
    }

    public Map<IndexSymbol, Long> subs() {
        return Collections.unmodifiableMap(subs);
    }

    @Override
    public String toString() {
        return "IndexingContext" + subs;
    }
}
