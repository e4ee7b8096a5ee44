package ai.coursedoc.transcoder.config;

import ai.coursedoc.transcoder.render.SummationHeuristic;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 */
public record Config(
        Path input,
        Optional<Path> output,
        SummationHeuristic summationHeuristic,
        int maxDepth,
        boolean prettyPrint,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        Objects.requireNonNull(input, "input");
        output = output == null ? Optional.empty() : output;
        summationHeuristic = Objects.requireNonNull(summationHeuristic, "summationHeuristic");
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1");
        }
    }
}
