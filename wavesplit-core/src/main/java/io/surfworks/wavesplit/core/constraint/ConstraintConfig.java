package io.surfworks.wavesplit.core.constraint;

import io.surfworks.wavesplit.core.symbolic.IndexingContext;

/**
 * Constraints of a kernel together with the static symbol bindings they are
 * resolved against.
 */
public record ConstraintConfig(ConstraintSet constraints, IndexingContext bindings) {
}
