package work.clibind.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable table of converters keyed by canonical type name.
 *
 * <p>Lookups try the exact name first and then, for generic types, the bare origin
 * ({@code Box<String>} falls back to {@code Box}). Nothing else is tried.
 */
public final class ConverterRegistry implements ConverterLookup {
    private static final ConverterRegistry EMPTY = new ConverterRegistry(Map.of());

    private final Map<String, Converter> converters;

    private ConverterRegistry(Map<String, Converter> converters) {
        this.converters = Collections.unmodifiableMap(new LinkedHashMap<>(converters));
    }

    public static ConverterRegistry empty() {
        return EMPTY;
    }

    /**
     * The builtin table (existing-path variants, UUIDs, ...).
     */
    public static ConverterRegistry defaults() {
        return Converters.defaults();
    }

    /**
     * Merges two tables; entries of {@code overrides} replace colliding entries of {@code defaults}.
     */
    public static ConverterRegistry merge(ConverterRegistry defaults, ConverterRegistry overrides) {
        Map<String, Converter> merged = new LinkedHashMap<>(defaults.converters);
        merged.putAll(overrides.converters);
        return new ConverterRegistry(merged);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Converter get(ArgType type) {
        return converters.get(type.canonicalName());
    }

    public Converter get(String canonicalName) {
        return converters.get(canonicalName);
    }

    @Override
    public Converter find(ArgType type) {
        Converter converter = get(type);
        if (converter == null && type.isGeneric()) {
            converter = converters.get(type.origin());
        }
        return converter;
    }

    /**
     * Same precedence as {@link #find(ArgType)} for a type that is only known by its name.
     */
    public Converter findByName(String canonicalName) {
        if (canonicalName == null) {
            return null;
        }
        Converter converter = converters.get(canonicalName);
        if (converter == null) {
            String origin = ArgType.originOf(canonicalName);
            if (!origin.equals(canonicalName)) {
                converter = converters.get(origin);
            }
        }
        return converter;
    }

    public Map<String, Converter> entries() {
        return converters;
    }

    public boolean isEmpty() {
        return converters.isEmpty();
    }

    public static final class Builder {
        private final Map<String, Converter> converters = new LinkedHashMap<>();

        public Builder put(ArgType type, Converter converter) {
            return put(type.canonicalName(), converter);
        }

        public Builder put(Class<?> type, Converter converter) {
            return put(ArgType.of(type), converter);
        }

        public Builder put(String canonicalName, Converter converter) {
            converters.put(Objects.requireNonNull(canonicalName, "canonicalName"), Objects.requireNonNull(converter, "converter"));
            return this;
        }

        public ConverterRegistry build() {
            return new ConverterRegistry(converters);
        }
    }
}
