package io.surfworks.wavesplit.core.constraint;

/**
 * A declarative constraint on how a kernel is distributed over the hardware.
 */
public sealed interface Constraint permits DistributionConstraint, HardwareConstraint, SymbolicAlias {
}
