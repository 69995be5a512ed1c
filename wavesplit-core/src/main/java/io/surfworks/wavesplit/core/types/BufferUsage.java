package io.surfworks.wavesplit.core.types;

/**
 * Optional usage tag of a kernel buffer.
 */
public enum BufferUsage {
    NONE,
    INPUT,
    OUTPUT
}
