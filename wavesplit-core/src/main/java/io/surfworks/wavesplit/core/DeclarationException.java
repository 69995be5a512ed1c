package io.surfworks.wavesplit.core;

/**
 * Exception thrown when a symbolic shape type or an index mapping is declared
 * with malformed arguments.
 */
public class DeclarationException extends WaveCompileException {

    public DeclarationException(String message) {
        super(message);
    }
}
