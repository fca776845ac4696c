package org.pragmatica.reclass.error;

/**
 * Unchecked carrier for a {@link ReclassError}.
 */
public final class ReclassException extends RuntimeException {
    private final transient ReclassError error;

    public ReclassException(ReclassError error) {
        super(error.message());
        this.error = error;
    }

    public ReclassException(ReclassError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public ReclassError error() {
        return error;
    }
}
