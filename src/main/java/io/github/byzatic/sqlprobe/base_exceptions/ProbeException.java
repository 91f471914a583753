package io.github.byzatic.sqlprobe.base_exceptions;

/**
 * Failure of a single probe execution. Always converted into an error status by the execution unit.
 */
public class ProbeException extends Exception {
    public ProbeException(String message) {
        super(message);
    }

    public ProbeException(Throwable cause) {
        super(cause);
    }

    public ProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
