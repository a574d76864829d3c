package work.clibind.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record StaticCommand(
    @JsonProperty("name") String name,
    @JsonProperty("args") List<StaticArg> args,
    @JsonProperty("description") String description,
    @JsonProperty("allow_extra") boolean allowExtra,
    @JsonProperty("parent") String parent,
    @JsonProperty("is_placeholder") boolean placeholder
) {
    public StaticCommand {
        args = args == null ? List.of() : List.copyOf(args);
    }
}
