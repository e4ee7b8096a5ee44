package ai.coursedoc.transcoder.writer;

import ai.coursedoc.transcoder.content.ConversionResult;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes conversion results as JSON for the content pipeline.
 */
public class ContentJsonWriter {

    private final ObjectMapper objectMapper;

    public ContentJsonWriter() {
        this(JsonMapper.builder().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET).build());
    }

    ContentJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(Path target, ConversionResult result, boolean prettyPrint) {
        if (target == null || result == null) {
            throw new IllegalArgumentException("target and result must be provided");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream output = Files.newOutputStream(target,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                write(output, result, prettyPrint);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write content JSON: " + target, ex);
        }
    }

    public void write(OutputStream output, ConversionResult result, boolean prettyPrint) {
        if (output == null || result == null) {
            throw new IllegalArgumentException("output and result must be provided");
        }
        ObjectWriter writer = prettyPrint ? objectMapper.writerWithDefaultPrettyPrinter() : objectMapper.writer();
        try {
            writer.writeValue(output, result);
            output.write(System.lineSeparator().getBytes(StandardCharsets.UTF_8));
            output.flush();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write content JSON", ex);
        }
    }
}
