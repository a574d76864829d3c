package work.clibind.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fully resolved description of one command parameter, ready to hand to the parser.
 *
 * @param id parameter name, also the key of the parsed value
 * @param hint the hint the argument was declared with
 * @param type resolved value type; {@code null} for flags
 * @param converter token converter; {@code null} for flags
 * @param origType declared type the argument was resolved from, used for display
 * @param defaultValue default value or {@link Unset#VALUE}
 * @param action parser action
 * @param choices allowed values, or {@code null}
 * @param hasConverter whether {@code converter} came from a converter table or hint
 * @param help help text shown to users (hint help plus the display type)
 */
public record ArgumentSpec(
    String id,
    ArgHint hint,
    ArgType type,
    Converter converter,
    ArgType origType,
    Object defaultValue,
    Action action,
    List<Object> choices,
    boolean hasConverter,
    String help
) {
    public ArgumentSpec {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(hint, "hint");
        Objects.requireNonNull(action, "action");
        if (action.isFlag()) {
            type = null;
            converter = null;
        }
        if (action == Action.COUNT && (defaultValue == null || Unset.isUnset(defaultValue) || Boolean.FALSE.equals(defaultValue))) {
            defaultValue = 0;
        }
        choices = choices == null ? null : List.copyOf(choices);
    }

    public ArgumentSpec withHelp(String newHelp) {
        return new ArgumentSpec(id, hint, type, converter, origType, defaultValue, action, choices, hasConverter, newHelp);
    }

    public Multiplicity multiplicity() {
        return action.multiplicity();
    }

    public boolean isRequired() {
        return Unset.isUnset(defaultValue);
    }

    public boolean isPositional() {
        return hint.isPositional();
    }

    /**
     * Name used in error messages and documentation: the long option, else the id.
     */
    public String displayName() {
        return hint.option() != null ? hint.option() : id;
    }

    /**
     * Option name of the negated form of a negatable flag, e.g. {@code --no-color}.
     */
    public String negatedOption() {
        if (hint.option() == null) {
            return null;
        }
        String bare = hint.option().replaceFirst("^-+", "");
        return "--no-" + bare;
    }

    /**
     * Type name for help texts; empty for counters.
     */
    public String displayType() {
        if (action == Action.COUNT) {
            return "";
        }
        if (hasConverter || type == null) {
            return origType == null ? "" : origType.displayName();
        }
        if (action == Action.STORE && type.isPrimitive()) {
            return type.displayName();
        }
        if (action == Action.APPEND && choices != null) {
            return ArgType.list(type).displayName();
        }
        return origType == null ? type.displayName() : origType.displayName();
    }

    /**
     * String forms of {@link #choices()}; enum constants are represented by their names.
     */
    public List<String> choiceStrings() {
        if (choices == null) {
            return null;
        }
        List<String> strings = new ArrayList<>(choices.size());
        for (Object choice : choices) {
            strings.add(choiceString(choice));
        }
        return strings;
    }

    public static String choiceString(Object value) {
        return value instanceof Enum<?> e ? e.name() : String.valueOf(value);
    }
}
