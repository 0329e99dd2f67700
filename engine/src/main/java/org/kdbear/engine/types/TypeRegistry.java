package org.kdbear.engine.types;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.kdbear.engine.execution.Value;
import org.kdbear.engine.execution.ValueKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Immutable lookup table from wire type codes, literal tags, names and value
 * kinds to {@link TypeDescriptor}s.
 *
 * Every switch on a type code goes through here. Atom codes are looked up by
 * their absolute value.
 */
public final class TypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(TypeRegistry.class);

    /**
     * Order in which {@link #inferType} tries candidate types.
     */
    static final ImmutableList<String> INFERENCE_ORDER = Lists.immutable.of(
            "boolean", "int", "long", "float", "date", "datetime", "time",
            "timestamp", "month", "timespan", "minute", "second");

    private static final TypeRegistry STANDARD = new TypeRegistry(StandardTypes.all());

    private final ImmutableList<TypeDescriptor> descriptors;
    private final ImmutableMap<Integer, TypeDescriptor> byCode;
    private final ImmutableMap<Character, TypeDescriptor> byTag;
    private final ImmutableMap<String, TypeDescriptor> byName;
    private final ImmutableMap<ValueKind, TypeDescriptor> byKind;

    TypeRegistry(ImmutableList<TypeDescriptor> descriptors) {
        MutableMap<Integer, TypeDescriptor> codes = Maps.mutable.empty();
        MutableMap<Character, TypeDescriptor> tags = Maps.mutable.empty();
        MutableMap<String, TypeDescriptor> names = Maps.mutable.empty();
        MutableMap<ValueKind, TypeDescriptor> kinds = Maps.mutable.empty();
        for (TypeDescriptor descriptor : descriptors) {
            putUnique(codes, descriptor.code(), descriptor);
            putUnique(tags, descriptor.literalTag(), descriptor);
            putUnique(names, descriptor.name(), descriptor);
            putUnique(kinds, descriptor.kind(), descriptor);
        }
        this.descriptors = descriptors;
        this.byCode = codes.toImmutable();
        this.byTag = tags.toImmutable();
        this.byName = names.toImmutable();
        this.byKind = kinds.toImmutable();
    }

    /**
     * @return the registry of all built-in types
     */
    public static TypeRegistry standard() {
        return STANDARD;
    }

    private static <K> void putUnique(MutableMap<K, TypeDescriptor> map, K key, TypeDescriptor descriptor) {
        TypeDescriptor previous = map.put(key, descriptor);
        if (previous != null) {
            throw new IllegalArgumentException("Duplicate key " + key + " for types "
                    + previous.name() + " and " + descriptor.name());
        }
    }

    // ==================== Lookup ====================

    public ImmutableList<TypeDescriptor> descriptors() {
        return descriptors;
    }

    /**
     * Looks up a type by wire code; atom codes are accepted as well.
     */
    public Optional<TypeDescriptor> descriptorFor(int code) {
        return Optional.ofNullable(byCode.get(Math.abs(code)));
    }

    /**
     * @throws UnsupportedTypeException if the code is not registered
     */
    public TypeDescriptor require(int code) {
        return descriptorFor(code).orElseThrow(() -> new UnsupportedTypeException(code));
    }

    public Optional<TypeDescriptor> descriptorForTag(char tag) {
        return Optional.ofNullable(byTag.get(tag));
    }

    public Optional<TypeDescriptor> descriptorForName(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Optional<TypeDescriptor> descriptorForKind(ValueKind kind) {
        return Optional.ofNullable(byKind.get(kind));
    }

    public boolean isRegistered(int code) {
        return byCode.containsKey(Math.abs(code));
    }

    // ==================== Operations ====================

    /**
     * Picks the first type, in {@link #INFERENCE_ORDER}, whose validator accepts
     * every non-empty sample. Falls back to symbol when nothing matches or when
     * every sample is empty.
     */
    public TypeDescriptor inferType(Iterable<String> samples) {
        ImmutableList<String> present = Lists.immutable.withAll(samples)
                .reject(s -> s == null || s.isEmpty());
        TypeDescriptor symbol = byName.get("symbol");
        if (present.isEmpty()) {
            return symbol;
        }
        return INFERENCE_ORDER
                .collect(byName::get)
                .select(d -> d != null)
                .detectIfNone(d -> present.allSatisfy(d::validate), () -> symbol);
    }

    /**
     * Formats a value of the given type as host text. Unknown codes format as
     * {@link TypeDescriptor#NULL_TEXT}.
     */
    public String format(int code, Value value) {
        Optional<TypeDescriptor> descriptor = descriptorFor(code);
        if (descriptor.isEmpty()) {
            log.warn("No descriptor for type code {}, formatting as {}", code, TypeDescriptor.NULL_TEXT);
            return TypeDescriptor.NULL_TEXT;
        }
        return descriptor.get().format(value);
    }

    /**
     * Checks one raw element of a vector of the given type against its null
     * sentinel. Elements of unknown types count as null.
     */
    public boolean isNull(int code, Object array, int index) {
        Optional<TypeDescriptor> descriptor = descriptorFor(code);
        if (descriptor.isEmpty()) {
            log.warn("No descriptor for type code {}, treating element as null", code);
            return true;
        }
        return descriptor.get().isNullAt(array, index);
    }

    /**
     * Renders a value as a q literal of its own kind.
     */
    public String toLiteral(Value value) {
        if (value.isNull()) {
            return "::";
        }
        return descriptorForKind(value.kind())
                .orElseThrow(() -> new IllegalArgumentException("No type for kind " + value.kind()))
                .toLiteral(value);
    }
}
