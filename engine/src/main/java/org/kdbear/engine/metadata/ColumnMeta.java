package org.kdbear.engine.metadata;

import org.kdbear.engine.wire.KType;

import java.util.Objects;

/**
 * Name and type of one table column.
 *
 * @param name     column name
 * @param typeTag  literal tag reported by the engine, blank for general columns
 * @param typeCode wire type code of the tag, 0 when the tag is not registered
 */
public record ColumnMeta(String name, char typeTag, int typeCode) {

    public ColumnMeta {
        Objects.requireNonNull(name, "name");
    }

    public boolean isSymbol() {
        return typeCode == KType.SYMBOL;
    }
}
