package work.clibind.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Serialized form of one argument. Types are stored by canonical name, defaults as strings.
 */
public record StaticArg(
    @JsonProperty("id") String id,
    @JsonProperty("option") String option,
    @JsonProperty("short") String shortName,
    @JsonProperty("orig_help") String origHelp,
    @JsonProperty("default") String defaultValue,
    @JsonProperty("help") String help,
    @JsonProperty("action") String action,
    @JsonProperty("choices") List<String> choices,
    @JsonProperty("has_converter") boolean hasConverter,
    @JsonProperty("type") String type,
    @JsonProperty("orig_type") String origType
) {}
