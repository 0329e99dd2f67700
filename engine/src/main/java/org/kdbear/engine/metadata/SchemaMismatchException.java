package org.kdbear.engine.metadata;

import org.kdbear.engine.KdbException;

/**
 * Thrown when a table's schema cannot be read or lacks what an operation needs.
 */
public class SchemaMismatchException extends KdbException {

    public SchemaMismatchException(String message) {
        super(message);
    }
}
