package ai.coursedoc.transcoder.content;

import java.util.Objects;

/**
 * Resolved treatment of a paragraph style and the content type used for its text.
 */
public record ParagraphStyle(StyleTreatment treatment, String contentType) {

    public ParagraphStyle {
        Objects.requireNonNull(treatment, "treatment");
        Objects.requireNonNull(contentType, "contentType");
    }
}
