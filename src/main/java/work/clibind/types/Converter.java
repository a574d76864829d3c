package work.clibind.types;

/**
 * Turns a raw command-line token into a typed value.
 */
@FunctionalInterface
public interface Converter {
    Object convert(String value) throws Exception;
}
