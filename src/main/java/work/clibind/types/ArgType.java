package work.clibind.types;

import com.fasterxml.jackson.core.type.TypeReference;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Semantic type of a command parameter.
 *
 * <p>Types are identified by their canonical name ({@code List<Integer>}, {@code Box<String>},
 * {@code Optional<Path>}), which is also the key used by {@link ConverterRegistry} and the
 * static snapshot. The generic origin of a type is the part of its name before the first
 * {@code <}.
 */
public final class ArgType {
    public enum Kind {
        STRING,
        INTEGER,
        FLOAT,
        PATH,
        BOOLEAN,
        ENUM,
        LITERAL,
        OPTIONAL,
        UNION,
        LIST,
        NAMED,
        NONE
    }

    public static final ArgType STRING = new ArgType(Kind.STRING, "String", List.of(), null, null, List.of());
    public static final ArgType INTEGER = new ArgType(Kind.INTEGER, "Integer", List.of(), null, null, List.of());
    public static final ArgType FLOAT = new ArgType(Kind.FLOAT, "Double", List.of(), null, null, List.of());
    public static final ArgType PATH = new ArgType(Kind.PATH, "Path", List.of(), null, null, List.of());
    public static final ArgType BOOLEAN = new ArgType(Kind.BOOLEAN, "Boolean", List.of(), null, null, List.of());
    public static final ArgType NONE = new ArgType(Kind.NONE, "Void", List.of(), null, null, List.of());

    /** Primitive value types, in the order list element types are searched. */
    public static final List<ArgType> BASE_TYPES = List.of(STRING, INTEGER, FLOAT, PATH);

    private final Kind kind;
    private final String name;
    private final List<ArgType> arguments;
    private final ArgType supertype;
    private final Class<?> javaClass;
    private final List<Object> literals;
    private final String canonicalName;

    private ArgType(Kind kind, String name, List<ArgType> arguments, ArgType supertype, Class<?> javaClass, List<Object> literals) {
        this(kind, name, arguments, supertype, javaClass, literals, null);
    }

    private ArgType(
        Kind kind,
        String name,
        List<ArgType> arguments,
        ArgType supertype,
        Class<?> javaClass,
        List<Object> literals,
        String canonicalName
    ) {
        this.kind = kind;
        this.name = name;
        this.arguments = List.copyOf(arguments);
        this.supertype = supertype;
        this.javaClass = javaClass;
        this.literals = List.copyOf(literals);
        this.canonicalName = canonicalName != null ? canonicalName : buildCanonicalName();
    }

    public static ArgType of(TypeReference<?> reference) {
        return of(reference.getType());
    }

    public static ArgType of(Type type) {
        Objects.requireNonNull(type, "type");
        if (type instanceof Class<?> cls) {
            return ofClass(cls);
        }
        if (type instanceof ParameterizedType parameterized) {
            Class<?> raw = (Class<?>) parameterized.getRawType();
            List<ArgType> args = Arrays.stream(parameterized.getActualTypeArguments())
                .map(ArgType::of)
                .collect(Collectors.toList());
            if (raw == Optional.class) {
                return optional(args.get(0));
            }
            if (isSequence(raw)) {
                return new ArgType(Kind.LIST, "List", args, null, raw, List.of());
            }
            return new ArgType(Kind.NAMED, raw.getSimpleName(), args, null, raw, List.of());
        }
        if (type instanceof WildcardType wildcard) {
            return of(wildcard.getUpperBounds()[0]);
        }
        if (type instanceof TypeVariable<?> variable) {
            return of(variable.getBounds()[0]);
        }
        throw new IllegalArgumentException("Cannot describe Java type: " + type.getTypeName());
    }

    private static ArgType ofClass(Class<?> cls) {
        if (cls == String.class) return STRING;
        if (cls == Integer.class || cls == int.class) return INTEGER;
        if (cls == Double.class || cls == double.class) return FLOAT;
        if (cls == Boolean.class || cls == boolean.class) return BOOLEAN;
        if (cls == Void.class || cls == void.class) return NONE;
        if (Path.class.isAssignableFrom(cls)) return PATH;
        if (cls.isEnum()) return enumType(cls);
        if (isSequence(cls)) return new ArgType(Kind.LIST, "List", List.of(), null, cls, List.of());
        return new ArgType(Kind.NAMED, cls.getSimpleName(), List.of(), null, cls, List.of());
    }

    private static boolean isSequence(Class<?> raw) {
        return raw == List.class || raw == Iterable.class || raw == Collection.class;
    }

    public static ArgType list(ArgType element) {
        return new ArgType(Kind.LIST, "List", List.of(element), null, List.class, List.of());
    }

    public static ArgType optional(ArgType value) {
        return new ArgType(Kind.OPTIONAL, "Optional", List.of(value), null, Optional.class, List.of());
    }

    public static ArgType union(ArgType... members) {
        if (members.length == 0) {
            throw new IllegalArgumentException("A union needs at least one member");
        }
        return new ArgType(Kind.UNION, "Union", Arrays.asList(members), null, null, List.of());
    }

    public static ArgType literal(Object... values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("A literal type needs at least one value");
        }
        return new ArgType(Kind.LITERAL, "Literal", List.of(), null, null, Arrays.asList(values));
    }

    public static ArgType enumType(Class<?> enumClass) {
        if (!enumClass.isEnum()) {
            throw new IllegalArgumentException(enumClass.getName() + " is not an enum");
        }
        return new ArgType(Kind.ENUM, enumClass.getSimpleName(), List.of(), null, enumClass, List.of());
    }

    /**
     * A user-defined type that is only known by name, e.g. a class handled by a custom converter.
     */
    public static ArgType named(String name) {
        return new ArgType(Kind.NAMED, requireName(name), List.of(), null, null, List.of());
    }

    /**
     * A distinct name for an existing type ({@code ExistingPath} over {@code Path}). Displayed as
     * {@code Name (Supertype)}.
     */
    public static ArgType named(String name, ArgType supertype) {
        return new ArgType(Kind.NAMED, requireName(name), List.of(), Objects.requireNonNull(supertype, "supertype"), null, List.of());
    }

    public static ArgType generic(String name, ArgType... arguments) {
        return new ArgType(Kind.NAMED, requireName(name), Arrays.asList(arguments), null, null, List.of());
    }

    /**
     * Type known only by its canonical name, as read back from a static snapshot. Names of the
     * primitive types map to their constants; anything else becomes an opaque named type.
     */
    public static ArgType fromCanonicalName(String canonicalName) {
        if (canonicalName == null || canonicalName.isBlank()) {
            return null;
        }
        for (ArgType known : List.of(STRING, INTEGER, FLOAT, PATH, BOOLEAN, NONE)) {
            if (known.canonicalName.equals(canonicalName)) {
                return known;
            }
        }
        return new ArgType(Kind.NAMED, originOf(canonicalName), List.of(), null, null, List.of(), canonicalName);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank() || name.indexOf('<') >= 0) {
            throw new IllegalArgumentException("Invalid type name: " + name);
        }
        return name;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Bare name without type arguments.
     */
    public String origin() {
        return name;
    }

    public String canonicalName() {
        return canonicalName;
    }

    public List<ArgType> arguments() {
        return arguments;
    }

    public List<Object> literals() {
        return literals;
    }

    public Optional<ArgType> supertype() {
        return Optional.ofNullable(supertype);
    }

    public Class<?> javaClass() {
        return javaClass;
    }

    public boolean isGeneric() {
        return !arguments.isEmpty() || !literals.isEmpty();
    }

    public boolean isPrimitive() {
        return BASE_TYPES.contains(this);
    }

    /**
     * Name shown to users in help texts and documentation.
     */
    public String displayName() {
        if (supertype != null) {
            return name + " (" + supertype.displayName() + ")";
        }
        if (arguments.isEmpty()) {
            return canonicalName;
        }
        return name + arguments.stream().map(ArgType::displayName).collect(Collectors.joining(", ", "<", ">"));
    }

    /**
     * Origin of a canonical type name: everything before the first {@code <}.
     */
    public static String originOf(String canonicalName) {
        int n = canonicalName.indexOf('<');
        return n < 0 ? canonicalName : canonicalName.substring(0, n);
    }

    private String buildCanonicalName() {
        if (kind == Kind.LITERAL) {
            List<String> parts = new ArrayList<>();
            for (Object value : literals) {
                parts.add(value instanceof String s ? '"' + s + '"' : String.valueOf(value));
            }
            return name + "<" + String.join(", ", parts) + ">";
        }
        if (arguments.isEmpty()) {
            return name;
        }
        return name + arguments.stream().map(ArgType::canonicalName).collect(Collectors.joining(", ", "<", ">"));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof ArgType type && kind == type.kind && canonicalName.equals(type.canonicalName);
    }

    @Override
    public int hashCode() {
        return canonicalName.hashCode();
    }

    @Override
    public String toString() {
        return canonicalName;
    }
}
