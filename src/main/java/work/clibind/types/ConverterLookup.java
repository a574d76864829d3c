package work.clibind.types;

/**
 * Finds the converter responsible for a semantic type, or {@code null} when there is none.
 */
@FunctionalInterface
public interface ConverterLookup {
    Converter find(ArgType type);

    static ConverterLookup none() {
        return type -> null;
    }
}
