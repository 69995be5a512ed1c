package io.surfworks.wavesplit.core.types;

/**
 * Tier of the memory hierarchy a buffer lives in.
 */
public enum AddressSpace {
    GLOBAL_MEMORY,
    SHARED_MEMORY,
    REGISTER
}
