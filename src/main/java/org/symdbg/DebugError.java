package org.symdbg;

/**
 * A classified failure reported to observers. Thrown only by code that runs synchronously; asynchronous failures
 * are passed around as values.
 */
public class DebugError extends Exception {
    private final ErrorType type;

    public DebugError(ErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public DebugError(ErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public ErrorType type() {
        return type;
    }

    @Override
    public String toString() {
        return type + ": " + getMessage();
    }
}
