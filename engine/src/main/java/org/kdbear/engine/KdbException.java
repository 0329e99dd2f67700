package org.kdbear.engine;

/**
 * Base class of every failure raised by this library.
 */
public class KdbException extends RuntimeException {

    public KdbException(String message) {
        super(message);
    }

    public KdbException(String message, Throwable cause) {
        super(message, cause);
    }
}
