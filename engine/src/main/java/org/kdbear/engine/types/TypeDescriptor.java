package org.kdbear.engine.types;

import org.kdbear.engine.execution.Value;
import org.kdbear.engine.execution.ValueKind;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Everything the library knows about one wire type.
 *
 * @param code          positive wire type code (vectors); atoms use the negation
 * @param name          canonical name, e.g. "long"
 * @param literalTag    single-character tag used by the engine's meta output
 * @param kind          the {@link Value} case this type decodes to
 * @param storage       backing array class of a vector of this type
 * @param validator     accepts host text this type can parse; null accepts anything
 * @param parser        host text to value, for non-empty text
 * @param formatter     non-null value to host text
 * @param literal       non-null value to engine literal text
 * @param nullLiteral   engine literal of this type's null
 * @param reader        raw element access and null sentinel check
 */
public record TypeDescriptor(
        int code,
        String name,
        char literalTag,
        ValueKind kind,
        Class<?> storage,
        Predicate<String> validator,
        Function<String, Value> parser,
        Function<Value, String> formatter,
        Function<Value, String> literal,
        String nullLiteral,
        ElementReader reader) {

    /**
     * Host text of every null value.
     */
    public static final String NULL_TEXT = "NULL";

    public TypeDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(storage, "storage");
        Objects.requireNonNull(parser, "parser");
        Objects.requireNonNull(formatter, "formatter");
        Objects.requireNonNull(literal, "literal");
        Objects.requireNonNull(nullLiteral, "nullLiteral");
        Objects.requireNonNull(reader, "reader");
    }

    public boolean validate(String text) {
        return validator == null || validator.test(text);
    }

    /**
     * Parses host text. Empty text is this type's null.
     *
     * @throws IllegalArgumentException if the text is not a valid literal of this type
     */
    public Value parse(String text) {
        if (text == null || text.isEmpty()) {
            return nullValue();
        }
        try {
            return parser.apply(text);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Cannot parse '" + text + "' as " + name, e);
        }
    }

    public Value nullValue() {
        return Value.NULL;
    }

    /**
     * Formats a value as host text; nulls format to {@link #NULL_TEXT}.
     */
    public String format(Value value) {
        if (value.isNull()) {
            return NULL_TEXT;
        }
        checkKind(value);
        return formatter.apply(value);
    }

    /**
     * Renders a value as an engine literal; nulls render as the typed null.
     */
    public String toLiteral(Value value) {
        if (value.isNull()) {
            return nullLiteral;
        }
        checkKind(value);
        return literal.apply(value);
    }

    /**
     * Renders host text as an engine literal of this type.
     */
    public String literalFromText(String text) {
        return toLiteral(parse(text));
    }

    public boolean isNullAt(Object array, int index) {
        return reader.isNullAt(array, index);
    }

    /**
     * Reads one element, checking the null sentinel first.
     */
    public Value readAt(Object array, int index) {
        if (reader.isNullAt(array, index)) {
            return Value.NULL;
        }
        return reader.read(array, index);
    }

    private void checkKind(Value value) {
        if (value.kind() != kind) {
            throw new IllegalArgumentException("Value " + value + " is not of type " + name);
        }
    }
}
