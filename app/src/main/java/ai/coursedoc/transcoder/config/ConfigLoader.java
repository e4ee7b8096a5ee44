package ai.coursedoc.transcoder.config;

import ai.coursedoc.transcoder.cli.CliArguments;
import ai.coursedoc.transcoder.render.LatexTranscoder;
import ai.coursedoc.transcoder.render.SummationHeuristic;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_INPUT = "TRANSCODER_INPUT";
    static final String ENV_OUTPUT = "TRANSCODER_OUTPUT";
    static final String ENV_INTEGRAL_HEURISTIC = "INTEGRAL_HEURISTIC";
    static final String ENV_MAX_NESTING_DEPTH = "MAX_NESTING_DEPTH";
    static final String ENV_PRETTY_PRINT = "PRETTY_PRINT";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_VERBOSE = "VERBOSE";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        Path input = Optional.ofNullable(arguments.input())
                .or(() -> environmentReader.get(ENV_INPUT)
                        .filter(ConfigLoader::isNotBlank)
                        .map(String::trim)
                        .map(Path::of))
                .orElseThrow(() -> new IllegalArgumentException("input document must be provided"));

        Optional<Path> output = Optional.ofNullable(arguments.output())
                .or(() -> environmentReader.get(ENV_OUTPUT)
                        .filter(ConfigLoader::isNotBlank)
                        .map(String::trim)
                        .map(Path::of));

        SummationHeuristic heuristic = resolveHeuristic(arguments);
        int maxDepth = resolveMaxDepth(arguments);
        boolean prettyPrint = arguments.prettyPrint() || resolveFlag(ENV_PRETTY_PRINT);
        boolean verbose = arguments.verbose() || resolveFlag(ENV_VERBOSE);
        LogFormat logFormat = resolveLogFormat(arguments);

        return new Config(input, output, heuristic, maxDepth, prettyPrint, logFormat, verbose);
    }

    private SummationHeuristic resolveHeuristic(CliArguments arguments) {
        SummationHeuristic cliHeuristic = arguments.summationHeuristic();
        if (cliHeuristic != null) {
            return cliHeuristic;
        }
        return environmentReader.get(ENV_INTEGRAL_HEURISTIC)
                .filter(ConfigLoader::isNotBlank)
                .map(SummationHeuristic::from)
                .orElse(SummationHeuristic.PERMISSIVE);
    }

    private int resolveMaxDepth(CliArguments arguments) {
        Integer cliDepth = arguments.maxDepth();
        if (cliDepth != null) {
            return requirePositive(cliDepth, "--max-depth");
        }
        return environmentReader.get(ENV_MAX_NESTING_DEPTH)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parseDepth)
                .orElse(LatexTranscoder.DEFAULT_MAX_DEPTH);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveFlag(String envKey) {
        return environmentReader.get(envKey)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private static int parseDepth(String raw) {
        try {
            return requirePositive(Integer.parseInt(raw), ENV_MAX_NESTING_DEPTH);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_MAX_NESTING_DEPTH + " must be an integer", ex);
        }
    }

    private static int requirePositive(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be at least 1");
        }
        return value;
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
