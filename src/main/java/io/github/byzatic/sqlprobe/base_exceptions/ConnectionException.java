package io.github.byzatic.sqlprobe.base_exceptions;

/**
 * The database could not be reached or refused the credentials.
 */
public class ConnectionException extends ProbeException {
    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(Throwable cause) {
        super(cause);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
