package work.clibind.api;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.clibind.parse.ParserSettings;
import work.clibind.types.ConverterRegistry;

/**
 * Immutable configuration of a {@link Cli}.
 *
 * @param prog program name used in usage lines and documentation
 * @param help global help text shown above the command overview
 * @param version version string printed by {@code --version}; {@code null} disables it
 * @param converters converter table, already merged over the builtin converters
 * @param errors error handlers keyed by exception type
 * @param extraKey parameter name receiving unrecognized tokens
 * @param fillDefaults whether defaults are filled in for arguments not given
 * @param out where help, version and overview text is printed
 */
public record CliSettings(
    String prog,
    String help,
    String version,
    ConverterRegistry converters,
    Map<Class<? extends Throwable>, ErrorHandler> errors,
    String extraKey,
    boolean fillDefaults,
    PrintWriter out
) {
    public CliSettings {
        help = help == null ? "" : help.strip();
        Objects.requireNonNull(converters, "converters");
        errors = errors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(errors));
        extraKey = extraKey == null ? ParserSettings.DEFAULT_EXTRA_KEY : extraKey;
        Objects.requireNonNull(out, "out");
    }

    public static CliSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ParserSettings parserSettings() {
        return new ParserSettings(prog, version, extraKey, fillDefaults);
    }

    public static final class Builder {
        private String prog;
        private String help = "";
        private String version;
        private ConverterRegistry converters = ConverterRegistry.empty();
        private final Map<Class<? extends Throwable>, ErrorHandler> errors = new LinkedHashMap<>();
        private String extraKey = ParserSettings.DEFAULT_EXTRA_KEY;
        private boolean fillDefaults = true;
        private PrintWriter out;

        public Builder prog(String prog) {
            this.prog = prog;
            return this;
        }

        public Builder help(String help) {
            this.help = help;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        /**
         * Custom converters; they replace builtin converters registered under the same type name.
         */
        public Builder converters(ConverterRegistry converters) {
            this.converters = converters;
            return this;
        }

        public Builder error(Class<? extends Throwable> type, ErrorHandler handler) {
            this.errors.put(type, handler);
            return this;
        }

        public Builder errors(Map<Class<? extends Throwable>, ErrorHandler> errors) {
            this.errors.putAll(errors);
            return this;
        }

        public Builder extraKey(String extraKey) {
            this.extraKey = extraKey;
            return this;
        }

        public Builder fillDefaults(boolean fillDefaults) {
            this.fillDefaults = fillDefaults;
            return this;
        }

        public Builder out(PrintWriter out) {
            this.out = out;
            return this;
        }

        public CliSettings build() {
            PrintWriter writer = out != null
                ? out
                : new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
            return new CliSettings(
                prog,
                help,
                version,
                ConverterRegistry.merge(ConverterRegistry.defaults(), converters),
                errors,
                extraKey,
                fillDefaults,
                writer
            );
        }
    }
}
