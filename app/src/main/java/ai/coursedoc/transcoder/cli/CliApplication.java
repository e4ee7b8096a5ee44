package ai.coursedoc.transcoder.cli;

import ai.coursedoc.transcoder.config.Config;
import ai.coursedoc.transcoder.config.ConfigLoader;
import ai.coursedoc.transcoder.config.SystemEnvironmentReader;
import ai.coursedoc.transcoder.content.ContentItemFactory;
import ai.coursedoc.transcoder.content.ConversionResult;
import ai.coursedoc.transcoder.content.DocumentConverter;
import ai.coursedoc.transcoder.content.EquationRenderer;
import ai.coursedoc.transcoder.content.ParagraphContentExtractor;
import ai.coursedoc.transcoder.content.RandomIdGenerator;
import ai.coursedoc.transcoder.docx.DocumentReadException;
import ai.coursedoc.transcoder.docx.DocxDocument;
import ai.coursedoc.transcoder.docx.DocxReader;
import ai.coursedoc.transcoder.logging.LoggingConfigurator;
import ai.coursedoc.transcoder.omml.OmmlParser;
import ai.coursedoc.transcoder.render.AlignmentBuilder;
import ai.coursedoc.transcoder.render.LatexTranscoder;
import ai.coursedoc.transcoder.writer.ContentJsonWriter;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and conversion pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final DocxReader docxReader;
    private final ContentJsonWriter jsonWriter;
    private final PrintStream stdout;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new DocxReader(), new ContentJsonWriter(), System.out);
    }

    CliApplication(ConfigLoader configLoader, DocxReader docxReader, ContentJsonWriter jsonWriter, PrintStream stdout) {
        this.configLoader = configLoader;
        this.docxReader = docxReader;
        this.jsonWriter = jsonWriter;
        this.stdout = stdout;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.debug("Transcoding {} (integralHeuristic={}, maxDepth={})",
                config.input(), config.summationHeuristic(), config.maxDepth());

        try {
            DocxDocument document = docxReader.read(config.input());
            ConversionResult result = createConverter(config).convert(document);
            if (config.output().isPresent()) {
                jsonWriter.write(config.output().get(), result, config.prettyPrint());
                LOGGER.info("Wrote {} content items to {}", result.content().size(), config.output().get());
            } else {
                jsonWriter.write(stdout, result, config.prettyPrint());
            }
            return 0;
        } catch (DocumentReadException | UncheckedIOException ex) {
            LOGGER.error("Conversion of {} failed: {}", config.input(), ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private DocumentConverter createConverter(Config config) {
        LatexTranscoder transcoder = new LatexTranscoder(config.summationHeuristic(), config.maxDepth());
        EquationRenderer equationRenderer = new EquationRenderer(transcoder, new AlignmentBuilder());
        ParagraphContentExtractor extractor = new ParagraphContentExtractor(new OmmlParser(config.maxDepth()), equationRenderer);
        return new DocumentConverter(extractor, new ContentItemFactory(new RandomIdGenerator()));
    }
}
