package ai.coursedoc.transcoder.docx;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Paragraphs of a Word document body, in document order.
 */
public record DocxDocument(Path source, List<DocxParagraph> paragraphs) {

    public DocxDocument {
        Objects.requireNonNull(source, "source");
        paragraphs = List.copyOf(Objects.requireNonNull(paragraphs, "paragraphs"));
    }
}
