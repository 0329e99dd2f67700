package org.kdbear.engine.execution;

import java.util.Objects;

/**
 * A single decoded value: a {@link ValueKind} tag plus its payload.
 *
 * Payload types: Boolean, Byte, Short, Integer, Long, Float (real), Double
 * (float), Character, String (symbol). Month, date, minute, second and time
 * carry an Integer offset, timestamp and timespan a Long, datetime a Double.
 * {@link #NULL} has no payload.
 */
public record Value(ValueKind kind, Object payload) {

    public static final Value NULL = new Value(ValueKind.NULL, null);

    public Value {
        Objects.requireNonNull(kind, "kind");
        if (kind == ValueKind.NULL ? payload != null : payload == null) {
            throw new IllegalArgumentException("Payload does not match kind " + kind);
        }
    }

    // ==================== Factory Methods ====================

    public static Value ofBoolean(boolean value) {
        return new Value(ValueKind.BOOLEAN, value);
    }

    public static Value ofByte(byte value) {
        return new Value(ValueKind.BYTE, value);
    }

    public static Value ofShort(short value) {
        return new Value(ValueKind.SHORT, value);
    }

    public static Value ofInt(int value) {
        return new Value(ValueKind.INTEGER, value);
    }

    public static Value ofLong(long value) {
        return new Value(ValueKind.LONG, value);
    }

    public static Value ofReal(float value) {
        return new Value(ValueKind.REAL, value);
    }

    public static Value ofFloat(double value) {
        return new Value(ValueKind.FLOAT, value);
    }

    public static Value ofChar(char value) {
        return new Value(ValueKind.CHAR, value);
    }

    public static Value ofSymbol(String value) {
        return new Value(ValueKind.SYMBOL, value);
    }

    public static Value ofTimestamp(long nanos) {
        return new Value(ValueKind.TIMESTAMP, nanos);
    }

    public static Value ofMonth(int months) {
        return new Value(ValueKind.MONTH, months);
    }

    public static Value ofDate(int days) {
        return new Value(ValueKind.DATE, days);
    }

    public static Value ofDateTime(double days) {
        return new Value(ValueKind.DATETIME, days);
    }

    public static Value ofTimespan(long nanos) {
        return new Value(ValueKind.TIMESPAN, nanos);
    }

    public static Value ofMinute(int minutes) {
        return new Value(ValueKind.MINUTE, minutes);
    }

    public static Value ofSecond(int seconds) {
        return new Value(ValueKind.SECOND, seconds);
    }

    public static Value ofTime(int millis) {
        return new Value(ValueKind.TIME, millis);
    }

    // ==================== Accessors ====================

    public boolean isNull() {
        return kind == ValueKind.NULL;
    }

    public boolean getBoolean() {
        return (Boolean) expect(ValueKind.BOOLEAN);
    }

    public byte getByte() {
        return (Byte) expect(ValueKind.BYTE);
    }

    public short getShort() {
        return (Short) expect(ValueKind.SHORT);
    }

    public int getInt() {
        return (Integer) expect(ValueKind.INTEGER);
    }

    public long getLong() {
        return (Long) expect(ValueKind.LONG);
    }

    public float getReal() {
        return (Float) expect(ValueKind.REAL);
    }

    public double getFloat() {
        return (Double) expect(ValueKind.FLOAT);
    }

    public char getChar() {
        return (Character) expect(ValueKind.CHAR);
    }

    public String getSymbol() {
        return (String) expect(ValueKind.SYMBOL);
    }

    /**
     * Integer offset of a month, date, minute, second or time value.
     */
    public int intOffset() {
        return switch (kind) {
            case MONTH, DATE, MINUTE, SECOND, TIME -> (Integer) payload;
            default -> throw wrongKind("int-backed temporal");
        };
    }

    /**
     * Nanosecond offset of a timestamp or timespan value.
     */
    public long nanos() {
        return switch (kind) {
            case TIMESTAMP, TIMESPAN -> (Long) payload;
            default -> throw wrongKind("timestamp or timespan");
        };
    }

    /**
     * Fractional days of a datetime value.
     */
    public double days() {
        return (Double) expect(ValueKind.DATETIME);
    }

    private Object expect(ValueKind expected) {
        if (kind != expected) {
            throw wrongKind(expected.name());
        }
        return payload;
    }

    private IllegalStateException wrongKind(String expected) {
        return new IllegalStateException("Not a " + expected + " value: " + this);
    }

    @Override
    public String toString() {
        return isNull() ? "null" : kind + "(" + payload + ")";
    }
}
