package org.kdbear.engine.query;

import org.kdbear.engine.KdbException;

/**
 * Thrown when a positional selection addresses a row or column the table does
 * not have. Raised before any selection query is sent.
 */
public class OutOfBoundsException extends KdbException {

    public OutOfBoundsException(String message) {
        super(message);
    }
}
