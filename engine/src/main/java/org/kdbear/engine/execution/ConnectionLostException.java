package org.kdbear.engine.execution;

import org.kdbear.engine.KdbException;

/**
 * Thrown by a {@link QueryExecutor} when the connection to the engine is gone.
 */
public class ConnectionLostException extends KdbException {

    public ConnectionLostException(String message) {
        super(message);
    }

    public ConnectionLostException(String message, Throwable cause) {
        super(message, cause);
    }
}
