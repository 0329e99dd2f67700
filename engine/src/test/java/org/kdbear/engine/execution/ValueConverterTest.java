package org.kdbear.engine.execution;

import org.kdbear.engine.types.TypeRegistry;
import org.kdbear.engine.types.UnsupportedTypeException;
import org.kdbear.engine.wire.KObject.KVector;
import org.kdbear.engine.wire.KObjects;
import org.kdbear.engine.wire.KType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ValueConverter Tests")
class ValueConverterTest {

    private final ValueConverter converter = new ValueConverter(TypeRegistry.standard());

    @Test
    @DisplayName("Atoms decode to their scalar, whatever the index")
    void testAtoms() {
        assertEquals(Value.ofLong(42), converter.convert(KObjects.longAtom(42), 0));
        assertEquals(Value.ofSymbol("AAPL"), converter.convert(KObjects.symbolAtom("AAPL"), 5));
        assertEquals(Value.ofDate(8780), converter.convert(KObjects.intTemporalAtom(KType.DATE, 8780), 0));
        assertEquals(Value.ofBoolean(true), converter.convert(KObjects.booleanAtom(true), 0));
    }

    @Test
    @DisplayName("Vectors decode the element at the index")
    void testVectors() {
        KVector prices = KObjects.floats(1.5, 2.5, 3.5);
        assertEquals(Value.ofFloat(2.5), converter.convert(prices, 1));
        assertEquals(Value.ofChar('b'), converter.convert(KObjects.chars("abc"), 1));
        assertEquals(Value.ofTimestamp(7L), converter.convert(KObjects.longTemporals(KType.TIMESTAMP, 5L, 7L), 1));
    }

    @Test
    @DisplayName("Index past the end of a vector is an error")
    void testVectorOutOfBounds() {
        KVector prices = KObjects.longs(1, 2, 3);
        assertThrows(IndexOutOfBoundsException.class, () -> converter.convert(prices, 3));
        assertThrows(IndexOutOfBoundsException.class, () -> converter.convert(prices, -1));
    }

    @Test
    @DisplayName("Null sentinels decode to NULL")
    void testNulls() {
        assertTrue(converter.convert(KObjects.longs(1, Long.MIN_VALUE), 1).isNull());
        assertTrue(converter.convert(KObjects.ints(Integer.MIN_VALUE), 0).isNull());
        assertTrue(converter.convert(KObjects.floats(Double.NaN), 0).isNull());
        assertTrue(converter.convert(KObjects.symbols("a", ""), 1).isNull());
        assertTrue(converter.convert(KObjects.intTemporals(KType.MINUTE, Integer.MIN_VALUE), 0).isNull());
        assertTrue(converter.convert(KObjects.shortAtom(Short.MIN_VALUE), 0).isNull());
    }

    @Test
    @DisplayName("General list elements take one more dispatch step")
    void testGeneralList() {
        var mixed = KObjects.list(KObjects.longAtom(1), KObjects.symbolAtom("x"), KObjects.chars("hello"),
                KObjects.chars(""));
        assertEquals(Value.ofLong(1), converter.convert(mixed, 0));
        assertEquals(Value.ofSymbol("x"), converter.convert(mixed, 1));
        assertEquals(Value.ofChar('h'), converter.convert(mixed, 2));
        assertTrue(converter.convert(mixed, 3).isNull());
        assertThrows(IndexOutOfBoundsException.class, () -> converter.convert(mixed, 4));
    }

    @Test
    @DisplayName("Unknown type codes are rejected")
    void testUnknownType() {
        KVector guids = new KVector(2, new long[] { 1, 2 });
        UnsupportedTypeException e = assertThrows(UnsupportedTypeException.class, () -> converter.convert(guids, 0));
        assertEquals(2, e.getTypeCode());
        assertThrows(UnsupportedTypeException.class,
                () -> converter.convert(KObjects.table(List.of("a"), List.of(KObjects.longs(1))), 0));
    }
}
