package work.clibind.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.clibind.types.ArgType;
import work.clibind.types.Unset;

/**
 * Declared parameters of a command function, in order.
 */
public final class Signature {
    private final List<Param> params;

    private Signature(List<Param> params) {
        this.params = List.copyOf(params);
    }

    public List<Param> params() {
        return params;
    }

    public Optional<Param> find(String name) {
        return params.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    public boolean isEmpty() {
        return params.isEmpty();
    }

    public static Signature empty() {
        return new Signature(Collections.emptyList());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * One parameter. A {@code null} type means "not declared" and is treated as {@code String};
     * {@link Unset#VALUE} as default means the parameter has none.
     */
    public record Param(String name, ArgType type, Object defaultValue) {
        public Param {
            Objects.requireNonNull(name, "name");
        }

        public boolean hasDefault() {
            return !Unset.isUnset(defaultValue);
        }
    }

    public static final class Builder {
        private final List<Param> params = new ArrayList<>();

        public Builder param(String name) {
            return add(new Param(name, null, Unset.VALUE));
        }

        public Builder param(String name, ArgType type) {
            return add(new Param(name, type, Unset.VALUE));
        }

        public Builder param(String name, ArgType type, Object defaultValue) {
            return add(new Param(name, type, defaultValue));
        }

        public Builder param(String name, Class<?> type) {
            return param(name, ArgType.of(type));
        }

        public Builder param(String name, Class<?> type, Object defaultValue) {
            return param(name, ArgType.of(type), defaultValue);
        }

        public Builder add(Param param) {
            for (Param existing : params) {
                if (existing.name().equals(param.name())) {
                    throw new IllegalArgumentException("Duplicate parameter: " + param.name());
                }
            }
            params.add(param);
            return this;
        }

        public Signature build() {
            return new Signature(params);
        }
    }
}
