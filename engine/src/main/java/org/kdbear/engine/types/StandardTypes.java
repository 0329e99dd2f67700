package org.kdbear.engine.types;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.kdbear.engine.execution.Value;
import org.kdbear.engine.execution.ValueKind;
import org.kdbear.engine.wire.KType;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.IntFunction;
import java.util.function.LongFunction;
import java.util.regex.Pattern;

/**
 * Descriptors of the built-in wire types.
 */
final class StandardTypes {

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
    private static final Pattern HEX_BYTE = Pattern.compile("0x[0-9a-fA-F]{1,2}");
    private static final Pattern DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern DATETIME = Pattern.compile("\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}(\\.\\d+)?");
    private static final Pattern TIME = Pattern.compile("\\d{2}:\\d{2}:\\d{2}(\\.\\d+)?");
    private static final Pattern TIMESTAMP = Pattern.compile("\\d{4}\\.\\d{2}\\.\\d{2}D\\d{2}:\\d{2}:\\d{2}\\.\\d{9}");
    private static final Pattern MONTH = Pattern.compile("\\d{4}\\.\\d{2}m");
    private static final Pattern TIMESPAN = Pattern.compile("\\d+D\\d{2}:\\d{2}:\\d{2}\\.\\d{9}");
    private static final Pattern MINUTE = Pattern.compile("\\d{2}:\\d{2}");
    private static final Pattern SECOND = Pattern.compile("\\d{2}:\\d{2}:\\d{2}");

    private static final Pattern SIGNED_MINUTE = Pattern.compile("-?\\d{2,}:\\d{2}");
    private static final Pattern SIGNED_SECOND = Pattern.compile("-?\\d{2,}:\\d{2}:\\d{2}");
    private static final Pattern SIGNED_TIME = Pattern.compile("-?\\d{2,}:\\d{2}:\\d{2}(\\.\\d+)?");
    private static final Pattern PLAIN_SYMBOL = Pattern.compile("[A-Za-z_.][A-Za-z0-9_.]*");

    private static final Set<String> TRUE_TEXT = Set.of("true", "1", "t", "yes", "y");
    private static final Set<String> FALSE_TEXT = Set.of("false", "0", "f", "no", "n");

    private StandardTypes() {
    }

    static ImmutableList<TypeDescriptor> all() {
        return Lists.immutable.of(
                booleanType(), byteType(), shortType(), intType(), longType(), realType(), floatType(),
                charType(), symbolType(), timestampType(), monthType(), dateType(), datetimeType(),
                timespanType(), minuteType(), secondType(), timeType());
    }

    // ==================== Primitive types ====================

    private static TypeDescriptor booleanType() {
        return new TypeDescriptor(KType.BOOLEAN, "boolean", 'b', ValueKind.BOOLEAN, boolean[].class,
                text -> {
                    String lower = text.toLowerCase(Locale.ROOT);
                    return lower.equals("true") || lower.equals("false") || lower.equals("1") || lower.equals("0");
                },
                text -> {
                    String lower = text.toLowerCase(Locale.ROOT);
                    if (TRUE_TEXT.contains(lower)) {
                        return Value.ofBoolean(true);
                    }
                    if (FALSE_TEXT.contains(lower)) {
                        return Value.ofBoolean(false);
                    }
                    throw new IllegalArgumentException("Not a boolean: " + text);
                },
                v -> Boolean.toString(v.getBoolean()),
                v -> v.getBoolean() ? "1b" : "0b",
                "0b",
                reader((a, i) -> false, (a, i) -> Value.ofBoolean(((boolean[]) a)[i])));
    }

    private static TypeDescriptor byteType() {
        return new TypeDescriptor(KType.BYTE, "byte", 'x', ValueKind.BYTE, byte[].class,
                text -> HEX_BYTE.matcher(text).matches() || inRange(text, 0, 255),
                text -> {
                    int value = HEX_BYTE.matcher(text).matches()
                            ? Integer.parseInt(text.substring(2), 16)
                            : Integer.parseInt(text);
                    if (value < 0 || value > 255) {
                        throw new IllegalArgumentException("Byte out of range: " + text);
                    }
                    return Value.ofByte((byte) value);
                },
                v -> Integer.toString(Byte.toUnsignedInt(v.getByte())),
                v -> String.format("0x%02x", Byte.toUnsignedInt(v.getByte())),
                "0x00",
                reader((a, i) -> false, (a, i) -> Value.ofByte(((byte[]) a)[i])));
    }

    private static TypeDescriptor shortType() {
        return new TypeDescriptor(KType.SHORT, "short", 'h', ValueKind.SHORT, short[].class,
                text -> inRange(text, Short.MIN_VALUE + 1, Short.MAX_VALUE),
                text -> Value.ofShort(checkNotSentinel(Short.parseShort(text), Short.MIN_VALUE)),
                v -> Short.toString(v.getShort()),
                v -> v.getShort() + "h",
                "0Nh",
                reader((a, i) -> ((short[]) a)[i] == Short.MIN_VALUE, (a, i) -> Value.ofShort(((short[]) a)[i])));
    }

    private static TypeDescriptor intType() {
        return new TypeDescriptor(KType.INT, "int", 'i', ValueKind.INTEGER, int[].class,
                text -> inRange(text, Integer.MIN_VALUE + 1L, Integer.MAX_VALUE),
                text -> Value.ofInt(checkNotSentinel(Integer.parseInt(text), Integer.MIN_VALUE)),
                v -> Integer.toString(v.getInt()),
                v -> v.getInt() + "i",
                "0Ni",
                reader((a, i) -> ((int[]) a)[i] == Integer.MIN_VALUE, (a, i) -> Value.ofInt(((int[]) a)[i])));
    }

    private static TypeDescriptor longType() {
        return new TypeDescriptor(KType.LONG, "long", 'j', ValueKind.LONG, long[].class,
                text -> inRange(text, Long.MIN_VALUE + 1, Long.MAX_VALUE),
                text -> Value.ofLong(checkNotSentinel(Long.parseLong(text), Long.MIN_VALUE)),
                v -> Long.toString(v.getLong()),
                v -> Long.toString(v.getLong()),
                "0N",
                reader((a, i) -> ((long[]) a)[i] == Long.MIN_VALUE, (a, i) -> Value.ofLong(((long[]) a)[i])));
    }

    private static TypeDescriptor realType() {
        return new TypeDescriptor(KType.REAL, "real", 'e', ValueKind.REAL, float[].class,
                text -> DECIMAL.matcher(text).matches(),
                text -> Value.ofReal(checkNotNaN(Float.parseFloat(text))),
                v -> Float.toString(v.getReal()),
                v -> {
                    float f = v.getReal();
                    if (Float.isInfinite(f)) {
                        return f > 0 ? "0we" : "-0we";
                    }
                    return new BigDecimal(Float.toString(f)).stripTrailingZeros().toPlainString() + "e";
                },
                "0Ne",
                reader((a, i) -> Float.isNaN(((float[]) a)[i]), (a, i) -> Value.ofReal(((float[]) a)[i])));
    }

    private static TypeDescriptor floatType() {
        return new TypeDescriptor(KType.FLOAT, "float", 'f', ValueKind.FLOAT, double[].class,
                text -> DECIMAL.matcher(text).matches(),
                text -> Value.ofFloat(checkNotNaN(Double.parseDouble(text))),
                v -> Double.toString(v.getFloat()),
                v -> {
                    double d = v.getFloat();
                    if (Double.isInfinite(d)) {
                        return d > 0 ? "0w" : "-0w";
                    }
                    String plain = new BigDecimal(Double.toString(d)).stripTrailingZeros().toPlainString();
                    return plain.contains(".") ? plain : plain + "f";
                },
                "0n",
                reader((a, i) -> Double.isNaN(((double[]) a)[i]), (a, i) -> Value.ofFloat(((double[]) a)[i])));
    }

    private static TypeDescriptor charType() {
        return new TypeDescriptor(KType.CHAR, "char", 'c', ValueKind.CHAR, char[].class,
                text -> text.length() == 1,
                text -> {
                    if (text.length() != 1) {
                        throw new IllegalArgumentException("Expected a single character: " + text);
                    }
                    return text.charAt(0) == ' ' ? Value.NULL : Value.ofChar(text.charAt(0));
                },
                v -> String.valueOf(v.getChar()),
                v -> QLiterals.string(String.valueOf(v.getChar())),
                "\" \"",
                reader((a, i) -> ((char[]) a)[i] == ' ', (a, i) -> Value.ofChar(((char[]) a)[i])));
    }

    private static TypeDescriptor symbolType() {
        return new TypeDescriptor(KType.SYMBOL, "symbol", 's', ValueKind.SYMBOL, String[].class,
                null,
                Value::ofSymbol,
                Value::getSymbol,
                v -> {
                    String s = v.getSymbol();
                    return PLAIN_SYMBOL.matcher(s).matches() ? "`" + s : "`$" + QLiterals.string(s);
                },
                "`",
                reader((a, i) -> {
                    String s = ((String[]) a)[i];
                    return s == null || s.isEmpty();
                }, (a, i) -> Value.ofSymbol(((String[]) a)[i])));
    }

    // ==================== Temporal types ====================

    private static TypeDescriptor timestampType() {
        return new TypeDescriptor(KType.TIMESTAMP, "timestamp", 'p', ValueKind.TIMESTAMP, long[].class,
                text -> TIMESTAMP.matcher(text).matches(),
                text -> Value.ofTimestamp(Epochs.parseTimestamp(text)),
                v -> Epochs.timestamp(v.nanos()),
                v -> Epochs.timestamp(v.nanos()),
                "0Np",
                longReader(Value::ofTimestamp));
    }

    private static TypeDescriptor monthType() {
        return new TypeDescriptor(KType.MONTH, "month", 'm', ValueKind.MONTH, int[].class,
                text -> MONTH.matcher(text).matches(),
                text -> Value.ofMonth(Epochs.parseMonth(text)),
                v -> Epochs.month(v.intOffset()),
                v -> Epochs.month(v.intOffset()),
                "0Nm",
                intReader(Value::ofMonth));
    }

    private static TypeDescriptor dateType() {
        return new TypeDescriptor(KType.DATE, "date", 'd', ValueKind.DATE, int[].class,
                text -> DATE.matcher(text).matches(),
                text -> Value.ofDate(Epochs.parseDate(text)),
                v -> Epochs.hostDate(v.intOffset()),
                v -> Epochs.qDate(v.intOffset()),
                "0Nd",
                intReader(Value::ofDate));
    }

    private static TypeDescriptor datetimeType() {
        return new TypeDescriptor(KType.DATETIME, "datetime", 'z', ValueKind.DATETIME, double[].class,
                text -> DATETIME.matcher(text).matches(),
                text -> Value.ofDateTime(Epochs.parseDateTime(text)),
                v -> Epochs.hostDateTime(v.days()),
                v -> Epochs.qDateTime(v.days()),
                "0Nz",
                reader((a, i) -> Double.isNaN(((double[]) a)[i]), (a, i) -> Value.ofDateTime(((double[]) a)[i])));
    }

    private static TypeDescriptor timespanType() {
        return new TypeDescriptor(KType.TIMESPAN, "timespan", 'n', ValueKind.TIMESPAN, long[].class,
                text -> TIMESPAN.matcher(text).matches(),
                text -> Value.ofTimespan(Epochs.parseTimespan(text)),
                v -> Epochs.timespan(v.nanos()),
                v -> Epochs.timespan(v.nanos()),
                "0Nn",
                longReader(Value::ofTimespan));
    }

    private static TypeDescriptor minuteType() {
        return new TypeDescriptor(KType.MINUTE, "minute", 'u', ValueKind.MINUTE, int[].class,
                text -> MINUTE.matcher(text).matches(),
                text -> Value.ofMinute(Math.toIntExact(clock(text, SIGNED_MINUTE) / 60_000L)),
                v -> Epochs.minute(v.intOffset()),
                v -> Epochs.minute(v.intOffset()),
                "0Nu",
                intReader(Value::ofMinute));
    }

    private static TypeDescriptor secondType() {
        return new TypeDescriptor(KType.SECOND, "second", 'v', ValueKind.SECOND, int[].class,
                text -> SECOND.matcher(text).matches(),
                text -> Value.ofSecond(Math.toIntExact(clock(text, SIGNED_SECOND) / 1000L)),
                v -> Epochs.second(v.intOffset()),
                v -> Epochs.second(v.intOffset()),
                "0Nv",
                intReader(Value::ofSecond));
    }

    private static TypeDescriptor timeType() {
        return new TypeDescriptor(KType.TIME, "time", 't', ValueKind.TIME, int[].class,
                text -> TIME.matcher(text).matches(),
                text -> Value.ofTime(Math.toIntExact(clock(text, SIGNED_TIME))),
                v -> Epochs.time(v.intOffset()),
                v -> Epochs.time(v.intOffset()),
                "0Nt",
                intReader(Value::ofTime));
    }

    // ==================== Helpers ====================

    private static ElementReader reader(BiPredicate<Object, Integer> isNull, BiFunction<Object, Integer, Value> read) {
        return new ElementReader() {
            @Override
            public boolean isNullAt(Object array, int index) {
                return isNull.test(array, index);
            }

            @Override
            public Value read(Object array, int index) {
                return read.apply(array, index);
            }
        };
    }

    private static ElementReader intReader(IntFunction<Value> factory) {
        return reader((a, i) -> ((int[]) a)[i] == Integer.MIN_VALUE, (a, i) -> factory.apply(((int[]) a)[i]));
    }

    private static ElementReader longReader(LongFunction<Value> factory) {
        return reader((a, i) -> ((long[]) a)[i] == Long.MIN_VALUE, (a, i) -> factory.apply(((long[]) a)[i]));
    }

    private static boolean inRange(String text, long min, long max) {
        if (!INTEGER.matcher(text).matches()) {
            return false;
        }
        try {
            long value = Long.parseLong(text);
            return value >= min && value <= max;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static long clock(String text, Pattern shape) {
        if (!shape.matcher(text).matches()) {
            throw new IllegalArgumentException("Unexpected clock format: " + text);
        }
        return Epochs.parseClockMillis(text);
    }

    private static short checkNotSentinel(short value, short sentinel) {
        if (value == sentinel) {
            throw new IllegalArgumentException("Value collides with the null sentinel: " + value);
        }
        return value;
    }

    private static int checkNotSentinel(int value, int sentinel) {
        if (value == sentinel) {
            throw new IllegalArgumentException("Value collides with the null sentinel: " + value);
        }
        return value;
    }

    private static long checkNotSentinel(long value, long sentinel) {
        if (value == sentinel) {
            throw new IllegalArgumentException("Value collides with the null sentinel: " + value);
        }
        return value;
    }

    private static float checkNotNaN(float value) {
        if (Float.isNaN(value)) {
            throw new IllegalArgumentException("NaN is the real null");
        }
        return value;
    }

    private static double checkNotNaN(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("NaN is the float null");
        }
        return value;
    }
}
