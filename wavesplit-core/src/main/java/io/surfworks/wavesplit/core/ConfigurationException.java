package io.surfworks.wavesplit.core;

/**
 * Exception thrown when the constraint configuration is unusable: wrong
 * constraint cardinality, a quantity that cannot be resolved statically, or a
 * malformed configuration document.
 */
public class ConfigurationException extends WaveCompileException {

    private final String subject;

    public ConfigurationException(String message) {
        super(message);
        this.subject = null;
    }

    public ConfigurationException(String subject, String message) {
        super(String.format("%s: %s", subject, message));
        this.subject = subject;
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.subject = null;
    }

    /**
     * Returns the dimension, constraint or expression at fault, or null if the
     * error is not tied to one.
     */
    public String getSubject() {
        return subject;
    }
}
