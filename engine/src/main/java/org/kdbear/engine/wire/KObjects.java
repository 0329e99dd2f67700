package org.kdbear.engine.wire;

import org.kdbear.engine.wire.KObject.KAtom;
import org.kdbear.engine.wire.KObject.KDict;
import org.kdbear.engine.wire.KObject.KList;
import org.kdbear.engine.wire.KObject.KTable;
import org.kdbear.engine.wire.KObject.KVector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Factory methods for wire objects.
 */
public final class KObjects {

    private KObjects() {
    }

    // ==================== Atoms ====================

    public static KAtom booleanAtom(boolean value) {
        return new KAtom(-KType.BOOLEAN, new boolean[] { value });
    }

    public static KAtom byteAtom(byte value) {
        return new KAtom(-KType.BYTE, new byte[] { value });
    }

    public static KAtom shortAtom(short value) {
        return new KAtom(-KType.SHORT, new short[] { value });
    }

    public static KAtom intAtom(int value) {
        return new KAtom(-KType.INT, new int[] { value });
    }

    public static KAtom longAtom(long value) {
        return new KAtom(-KType.LONG, new long[] { value });
    }

    public static KAtom realAtom(float value) {
        return new KAtom(-KType.REAL, new float[] { value });
    }

    public static KAtom floatAtom(double value) {
        return new KAtom(-KType.FLOAT, new double[] { value });
    }

    public static KAtom charAtom(char value) {
        return new KAtom(-KType.CHAR, new char[] { value });
    }

    public static KAtom symbolAtom(String value) {
        return new KAtom(-KType.SYMBOL, new String[] { value });
    }

    /**
     * Atom of an int-backed temporal type (month, date, minute, second, time).
     */
    public static KAtom intTemporalAtom(int type, int value) {
        return new KAtom(-type, new int[] { value });
    }

    /**
     * Atom of a long-backed temporal type (timestamp, timespan).
     */
    public static KAtom longTemporalAtom(int type, long value) {
        return new KAtom(-type, new long[] { value });
    }

    public static KAtom datetimeAtom(double days) {
        return new KAtom(-KType.DATETIME, new double[] { days });
    }

    // ==================== Vectors ====================

    public static KVector booleans(boolean... values) {
        return new KVector(KType.BOOLEAN, values);
    }

    public static KVector bytes(byte... values) {
        return new KVector(KType.BYTE, values);
    }

    public static KVector shorts(short... values) {
        return new KVector(KType.SHORT, values);
    }

    public static KVector ints(int... values) {
        return new KVector(KType.INT, values);
    }

    public static KVector longs(long... values) {
        return new KVector(KType.LONG, values);
    }

    public static KVector reals(float... values) {
        return new KVector(KType.REAL, values);
    }

    public static KVector floats(double... values) {
        return new KVector(KType.FLOAT, values);
    }

    public static KVector chars(String text) {
        return new KVector(KType.CHAR, text.toCharArray());
    }

    public static KVector symbols(String... values) {
        return new KVector(KType.SYMBOL, values);
    }

    public static KVector intTemporals(int type, int... values) {
        return new KVector(type, values);
    }

    public static KVector longTemporals(int type, long... values) {
        return new KVector(type, values);
    }

    public static KVector datetimes(double... days) {
        return new KVector(KType.DATETIME, days);
    }

    // ==================== Compound ====================

    public static KList list(KObject... elements) {
        return new KList(Arrays.asList(elements));
    }

    public static KTable table(List<String> columnNames, List<? extends KObject> columns) {
        return new KTable(symbols(columnNames.toArray(new String[0])), new KList(new ArrayList<>(columns)));
    }

    public static KDict dict(KObject keys, KObject values) {
        return new KDict(keys, values);
    }

    /**
     * Flattens a keyed table into a plain table (key columns first), the host-side
     * counterpart of {@code 0!}. Plain tables are returned as-is.
     *
     * @throws IllegalArgumentException if the object is neither a table nor a keyed table
     */
    public static KTable unkey(KObject object) {
        if (object instanceof KTable table) {
            return table;
        }
        if (object instanceof KDict dict && dict.isKeyedTable()) {
            KTable keys = (KTable) dict.keys();
            KTable values = (KTable) dict.values();
            List<String> names = new ArrayList<>();
            List<KObject> columns = new ArrayList<>();
            for (KTable part : List.of(keys, values)) {
                for (int i = 0; i < part.columnCount(); i++) {
                    names.add(part.columnName(i));
                    columns.add(part.column(i));
                }
            }
            return table(names, columns);
        }
        throw new IllegalArgumentException("Not a table: type " + object.type());
    }
}
