package org.kdbear.engine.types;

import org.kdbear.engine.KdbException;

/**
 * Thrown when a wire type code has no registered descriptor.
 */
public class UnsupportedTypeException extends KdbException {

    private final int typeCode;

    public UnsupportedTypeException(int typeCode) {
        super("Unsupported type code: " + typeCode);
        this.typeCode = typeCode;
    }

    public int getTypeCode() {
        return typeCode;
    }
}
