package io.surfworks.wavesplit.core.types;

/**
 * Compile-time type tag attached to a graph node: either a scalar element
 * type or a symbolically shaped buffer/register.
 */
public sealed interface ValueType permits DataType, ShapedType {
}
