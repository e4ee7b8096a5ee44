package ai.coursedoc.transcoder.content;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Objects;

/**
 * Content items of a whole document and the number of equations that were skipped along the way.
 */
@JsonPropertyOrder({"content", "skippedEquations"})
public record ConversionResult(List<ContentItem> content, int skippedEquations) {

    public ConversionResult {
        content = List.copyOf(Objects.requireNonNull(content, "content"));
        if (skippedEquations < 0) {
            throw new IllegalArgumentException("skippedEquations must not be negative");
        }
    }
}
