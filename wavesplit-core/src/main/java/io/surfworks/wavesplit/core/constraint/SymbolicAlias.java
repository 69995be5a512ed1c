package io.surfworks.wavesplit.core.constraint;

import java.util.Map;

import io.surfworks.wavesplit.core.symbolic.IndexExpr;
import io.surfworks.wavesplit.core.symbolic.IndexSymbol;

/**
 * Declares {@code source} as derived from {@code target}.
 *
 * @param sourceFromTarget expression over {@code target} giving the value of {@code source}
 */
public record SymbolicAlias(IndexSymbol source, IndexSymbol target, IndexExpr sourceFromTarget)
        implements Constraint {

    /**
     * An alias whose source equals its target.
     */
    public static SymbolicAlias of(IndexSymbol source, IndexSymbol target) {
        return new SymbolicAlias(source, target, target);
    }

    /**
     * Computes the source value for a given target value.
     */
    public IndexExpr sourceValue(IndexExpr targetValue) {
        return sourceFromTarget.substitute(Map.of(target, targetValue));
    }
}
