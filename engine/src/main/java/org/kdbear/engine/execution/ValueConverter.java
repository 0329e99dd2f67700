package org.kdbear.engine.execution;

import org.kdbear.engine.types.TypeRegistry;
import org.kdbear.engine.types.UnsupportedTypeException;
import org.kdbear.engine.wire.KObject;
import org.kdbear.engine.wire.KObject.KAtom;
import org.kdbear.engine.wire.KObject.KList;
import org.kdbear.engine.wire.KObject.KVector;

import java.util.Objects;

/**
 * Decodes one element of a wire object into a {@link Value}.
 *
 * Dispatch:
 * - atom: the scalar itself, {@code index} is ignored
 * - vector: the element at {@code index}
 * - general list: the element at {@code index}, decoded by one more dispatch step
 *   at position 0 (a string cell yields its first character)
 *
 * Nulls are detected on the raw element through the type's descriptor before
 * anything is decoded.
 */
public final class ValueConverter {

    private final TypeRegistry registry;

    public ValueConverter(TypeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * @throws IndexOutOfBoundsException if {@code index} is outside a vector or list
     * @throws UnsupportedTypeException  if the element's type code is not registered
     */
    public Value convert(KObject object, int index) {
        if (object instanceof KAtom atom) {
            return registry.require(atom.elementType()).readAt(atom.data(), 0);
        }
        if (object instanceof KVector vector) {
            checkIndex(index, vector.count());
            return registry.require(vector.type()).readAt(vector.data(), index);
        }
        if (object instanceof KList list) {
            checkIndex(index, list.count());
            KObject element = list.get(index);
            if (element.count() == 0 && (element instanceof KVector || element instanceof KList)) {
                return Value.NULL;
            }
            return convert(element, 0);
        }
        throw new UnsupportedTypeException(object.type());
    }

    private static void checkIndex(int index, int count) {
        if (index < 0 || index >= count) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + count);
        }
    }
}
