package org.kdbear.engine.types;

import org.kdbear.engine.execution.Value;

/**
 * Reads one element of a vector's backing array.
 *
 * The null check compares the raw element against the type's sentinel and must
 * be applied before {@link #read}.
 */
public interface ElementReader {

    boolean isNullAt(Object array, int index);

    Value read(Object array, int index);
}
