package work.clibind.runtime;

import java.util.Map;

/**
 * Body of a command. Receives the parsed values keyed by parameter name.
 */
@FunctionalInterface
public interface CommandFunction {
    void invoke(Map<String, Object> values) throws Exception;

    static CommandFunction noop() {
        return values -> {};
    }
}
