package ai.coursedoc.transcoder.cli;

import ai.coursedoc.transcoder.render.SummationHeuristic;
import picocli.CommandLine;

/**
 * Parses the {@code --integral-heuristic} option.
 */
public class SummationHeuristicConverter implements CommandLine.ITypeConverter<SummationHeuristic> {
    @Override
    public SummationHeuristic convert(String value) {
        return SummationHeuristic.from(value);
    }
}
