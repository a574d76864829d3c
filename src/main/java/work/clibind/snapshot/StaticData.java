package work.clibind.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serialized form of a whole CLI: settings plus every command and subcommand.
 */
public record StaticData(
    @JsonProperty("prog") String prog,
    @JsonProperty("help") String help,
    @JsonProperty("version") String version,
    @JsonProperty("extra_key") String extraKey,
    @JsonProperty("commands") Map<String, StaticCommand> commands,
    @JsonProperty("subcommands") Map<String, Map<String, StaticCommand>> subcommands
) {
    public StaticData {
        commands = commands == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(commands));
        subcommands = subcommands == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(subcommands));
    }
}
