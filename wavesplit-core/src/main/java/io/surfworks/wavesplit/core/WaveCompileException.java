package io.surfworks.wavesplit.core;

/**
 * Root of the fatal errors raised while compiling a wave kernel.
 *
 * <p>None of these are transient: they stem from an invalid or incomplete
 * kernel model and must be fixed by the caller.
 */
public class WaveCompileException extends RuntimeException {

    public WaveCompileException(String message) {
        super(message);
    }

    public WaveCompileException(String message, Throwable cause) {
        super(message, cause);
    }
}
