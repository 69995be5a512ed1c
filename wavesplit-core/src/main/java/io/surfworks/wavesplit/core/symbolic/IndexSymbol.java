package io.surfworks.wavesplit.core.symbolic;

import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * A named index symbol: a logical problem dimension ({@code M}, {@code K}),
 * a tile size ({@code BLOCK_M}) or a synthesized iterator ({@code $index0}).
 */
public record IndexSymbol(String name) implements IndexExpr {

    public IndexSymbol {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Index symbol name must not be blank");
        }
    }

    @Override
    public IndexExpr substitute(Map<IndexSymbol, ? extends IndexExpr> subs) {
        IndexExpr replacement = subs.get(this);
        return replacement != null ? replacement : this;
    }

    @Override
    public OptionalLong evaluate(Map<IndexSymbol, Long> bindings) {
        Long value = bindings.get(this);
        return value != null ? OptionalLong.of(value) : OptionalLong.empty();
    }

    @Override
    public void collectSymbols(Set<IndexSymbol> out) {
        out.add(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
