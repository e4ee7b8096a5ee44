package ai.coursedoc.transcoder.cli;

import ai.coursedoc.transcoder.config.LogFormat;
import ai.coursedoc.transcoder.render.SummationHeuristic;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "math-transcoder", mixinStandardHelpOptions = true,
        description = "Converts paragraphs and Office Math equations of a Word document into LaTeX content items")
public class CliArguments {

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "FILE",
            description = "Word document (.docx) or its word/document.xml part")
    private Path input;

    @CommandLine.Option(names = {"-o", "--output"}, paramLabel = "FILE", description = "Write JSON to FILE instead of stdout")
    private Path output;

    @CommandLine.Option(names = "--integral-heuristic", converter = SummationHeuristicConverter.class, paramLabel = "POLICY",
            description = "When a summation with limits is read as an integral: permissive, simple-limits or disabled")
    private SummationHeuristic summationHeuristic;

    @CommandLine.Option(names = "--max-depth", paramLabel = "LEVELS", description = "Maximum nesting depth of an equation")
    private Integer maxDepth;

    @CommandLine.Option(names = "--pretty", description = "Pretty-print the JSON output")
    private boolean prettyPrint;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log debug details")
    private boolean verbose;

    public Path input() {
        return input;
    }

    public Path output() {
        return output;
    }

    public SummationHeuristic summationHeuristic() {
        return summationHeuristic;
    }

    public Integer maxDepth() {
        return maxDepth;
    }

    public boolean prettyPrint() {
        return prettyPrint;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
