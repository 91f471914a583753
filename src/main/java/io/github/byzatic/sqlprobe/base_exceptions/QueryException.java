package io.github.byzatic.sqlprobe.base_exceptions;

/**
 * The connection was opened but the probe query failed.
 */
public class QueryException extends ProbeException {
    public QueryException(String message) {
        super(message);
    }

    public QueryException(Throwable cause) {
        super(cause);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
