package ai.coursedoc.transcoder.cli;

import static ai.coursedoc.transcoder.XmlFixtures.document;
import static ai.coursedoc.transcoder.XmlFixtures.run;
import static org.assertj.core.api.Assertions.assertThat;

import ai.coursedoc.transcoder.config.ConfigLoader;
import ai.coursedoc.transcoder.docx.DocxReader;
import ai.coursedoc.transcoder.writer.ContentJsonWriter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private static final String BODY = ""
            + "<w:p><w:pPr><w:pStyle w:val=\"# Body\"/></w:pPr><w:r><w:t>Sums</w:t></w:r></w:p>"
            + "<w:p><w:pPr><w:pStyle w:val=\"# Bullet-1\"/></w:pPr><w:r><w:t>Total:</w:t></w:r><m:oMath><m:nary>"
            + "<m:sub>" + run("i=1") + "</m:sub><m:sup>" + run("n") + "</m:sup><m:e>" + run("i") + "</m:e>"
            + "</m:nary></m:oMath></w:p>";

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private CliApplication application;
    private Path input;

    @BeforeEach
    void setUp() throws IOException {
        input = tempDir.resolve("document.xml");
        Files.writeString(input, document(BODY), StandardCharsets.UTF_8);
        application = new CliApplication(new ConfigLoader(key -> Optional.empty()), new DocxReader(),
                new ContentJsonWriter(), new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    @Test
    void writesContentJsonToOutputFile() throws IOException {
        Path output = tempDir.resolve("out/content.json");

        int exitCode = application.run(new String[] {input.toString(), "--output", output.toString()});

        assertThat(exitCode).isZero();
        assertThat(stdout.size()).isZero();
        JsonNode tree = objectMapper.readTree(output.toFile());
        assertThat(tree.get("skippedEquations").asInt()).isZero();
        JsonNode content = tree.get("content");
        assertThat(content).hasSize(2);
        assertThat(content.get(0).get("type").asText()).isEqualTo("body");
        assertThat(content.get(0).get("text").asText()).isEqualTo("Sums");
        assertThat(content.get(1).get("type").asText()).isEqualTo("paragraph");
        assertThat(content.get(1).get("items").get(1).get("equation").asText()).isEqualTo("\\sum_{i=1}^{n}i");
    }

    @Test
    void writesContentJsonToStdoutWhenNoOutputGiven() throws IOException {
        int exitCode = application.run(new String[] {input.toString(), "--pretty"});

        assertThat(exitCode).isZero();
        JsonNode tree = objectMapper.readTree(stdout.toString(StandardCharsets.UTF_8));
        assertThat(tree.get("content").get(1).get("items").get(0).get("text").asText()).isEqualTo("Total:");
    }

    @Test
    void integralHeuristicOptionChangesOperator() throws IOException {
        Files.writeString(input, document("<w:p><m:oMath><m:nary>"
                + "<m:sub>" + run("a") + "</m:sub><m:sup>" + run("b") + "</m:sup><m:e>" + run("f(x)dx") + "</m:e>"
                + "</m:nary></m:oMath></w:p>"), StandardCharsets.UTF_8);

        assertThat(application.run(new String[] {input.toString()})).isZero();
        assertThat(equationOnStdout()).isEqualTo("\\int_{a}^{b}f(x)dx");

        stdout.reset();
        assertThat(application.run(new String[] {input.toString(), "--integral-heuristic", "disabled"})).isZero();
        assertThat(equationOnStdout()).isEqualTo("\\sum_{a}^{b}f(x)dx");
    }

    @Test
    void missingDocumentFailsWithErrorExitCode() {
        int exitCode = application.run(new String[] {tempDir.resolve("missing.docx").toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
        assertThat(stdout.size()).isZero();
    }

    @Test
    void missingInputIsUsageError() {
        int exitCode = application.run(new String[0]);

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void unknownHeuristicIsUsageError() {
        int exitCode = application.run(new String[] {input.toString(), "--integral-heuristic", "sometimes"});

        assertThat(exitCode).isEqualTo(2);
    }

    private String equationOnStdout() throws IOException {
        JsonNode tree = objectMapper.readTree(stdout.toString(StandardCharsets.UTF_8));
        return tree.get("content").get(0).get("equation").asText();
    }
}
