package work.clibind.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves a declared parameter type into an {@link ArgumentSpec}.
 *
 * <p>Resolution order, first match wins:
 * <ol>
 *   <li>counters ({@link ArgHint#count()})</li>
 *   <li>a converter for the exact type, then for its generic origin</li>
 *   <li>{@code Optional<T>} and unions, resolved against their first non-{@code Void} member</li>
 *   <li>primitive value types ({@code String}, {@code Integer}, {@code Double}, {@code Path})</li>
 *   <li>booleans, which must be options</li>
 *   <li>enums</li>
 *   <li>literal types</li>
 *   <li>lists of literals, then other lists</li>
 * </ol>
 * Anything else is an {@link UnsupportedTypeException}.
 */
public final class TypeResolver {
    private TypeResolver() {}

    public static ArgumentSpec resolve(String id, ArgHint hint, ArgType declared, Object defaultValue, ConverterLookup converters) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(declared, "declared");
        return resolveType(
            id,
            hint == null ? ArgHint.none() : hint,
            declared,
            defaultValue,
            converters == null ? ConverterLookup.none() : converters
        );
    }

    private static ArgumentSpec resolveType(String id, ArgHint hint, ArgType declared, Object defaultValue, ConverterLookup converters) {
        if (hint.count()) {
            if (hint.isPositional()) {
                throw new InvalidArgumentException(id, "counted arguments need to be flags, e.g. " + flagName(id));
            }
            return new ArgumentSpec(id, hint, null, null, declared, defaultValue, Action.COUNT, null, false, hint.help());
        }

        Converter converter = converters.find(declared);
        if (converter != null) {
            return new ArgumentSpec(id, hint, declared, converter, declared, defaultValue, Action.STORE, null, true, hint.help());
        }

        switch (declared.kind()) {
            case OPTIONAL:
                return resolveType(id, hint, declared.arguments().get(0), defaultOrNull(defaultValue), converters);
            case UNION: {
                List<ArgType> members = withoutNone(declared.arguments());
                if (members.isEmpty()) {
                    throw new UnsupportedTypeException(id, declared);
                }
                // Only the first member is used: Union<String, Integer> parses as String.
                Object memberDefault = members.size() < declared.arguments().size() ? defaultOrNull(defaultValue) : defaultValue;
                return resolveType(id, hint, members.get(0), memberDefault, converters);
            }
            case STRING:
            case INTEGER:
            case FLOAT:
            case PATH:
                return new ArgumentSpec(id, hint, declared, Converters.primitive(declared), declared, defaultValue, Action.STORE, null, false, hint.help());
            case BOOLEAN:
                return resolveBoolean(id, hint, declared, defaultValue);
            case ENUM:
                return resolveEnum(id, hint, declared, defaultValue);
            case LITERAL: {
                ArgType valueType = Converters.typeOfValue(declared.literals().get(0));
                return new ArgumentSpec(id, hint, valueType, Converters.primitive(valueType), declared, defaultValue,
                    Action.STORE, declared.literals(), false, hint.help());
            }
            case LIST:
                return resolveList(id, hint, declared, defaultValue);
            default:
                throw new UnsupportedTypeException(id, declared);
        }
    }

    private static ArgumentSpec resolveBoolean(String id, ArgHint hint, ArgType declared, Object defaultValue) {
        if (hint.option() == null) {
            throw new InvalidArgumentException(id, "boolean arguments need to be flags, e.g. " + flagName(id));
        }
        if (Boolean.TRUE.equals(defaultValue)) {
            return new ArgumentSpec(id, hint, null, null, declared, true, Action.NEGATABLE, null, false, hint.help());
        }
        return new ArgumentSpec(id, hint, null, null, declared, false, Action.STORE_TRUE, null, false, hint.help());
    }

    private static ArgumentSpec resolveEnum(String id, ArgHint hint, ArgType declared, Object defaultValue) {
        Object[] constants = declared.javaClass().getEnumConstants();
        Map<String, Object> byName = new LinkedHashMap<>();
        for (Object constant : constants) {
            byName.put(((Enum<?>) constant).name(), constant);
        }
        Converter converter = value -> byName.getOrDefault(value, value);
        return new ArgumentSpec(id, hint, declared, converter, declared, defaultValue, Action.STORE,
            Arrays.asList(constants), false, hint.help());
    }

    private static ArgumentSpec resolveList(String id, ArgHint hint, ArgType declared, Object defaultValue) {
        List<ArgType> arguments = declared.arguments();
        if (!arguments.isEmpty() && arguments.get(0).kind() == ArgType.Kind.LITERAL) {
            ArgType literal = arguments.get(0);
            ArgType valueType = Converters.typeOfValue(literal.literals().get(0));
            return new ArgumentSpec(id, hint, valueType, Converters.primitive(valueType), declared, defaultValue,
                Action.APPEND, literal.literals(), false, hint.help());
        }
        ArgType valueType = findBaseType(arguments);
        return new ArgumentSpec(id, hint, valueType, Converters.primitive(valueType), declared, defaultValue,
            Action.APPEND, null, false, hint.help());
    }

    /**
     * First primitive type (in {@link ArgType#BASE_TYPES} order) among the given types or the
     * members of optional/union types among them; {@code String} when there is none.
     */
    public static ArgType findBaseType(List<ArgType> types) {
        List<ArgType> candidates = new ArrayList<>();
        for (ArgType type : types) {
            candidates.add(type);
            if (type.kind() == ArgType.Kind.OPTIONAL || type.kind() == ArgType.Kind.UNION) {
                candidates.addAll(type.arguments());
            }
        }
        for (ArgType base : ArgType.BASE_TYPES) {
            if (candidates.contains(base)) {
                return base;
            }
        }
        return ArgType.STRING;
    }

    private static List<ArgType> withoutNone(List<ArgType> members) {
        List<ArgType> result = new ArrayList<>(members.size());
        for (ArgType member : members) {
            if (member.kind() != ArgType.Kind.NONE) {
                result.add(member);
            }
        }
        return result;
    }

    private static Object defaultOrNull(Object defaultValue) {
        return Unset.isUnset(defaultValue) ? null : defaultValue;
    }

    static String flagName(String id) {
        return "--" + id.replace('_', '-');
    }
}
