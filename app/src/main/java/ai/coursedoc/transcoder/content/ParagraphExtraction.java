package ai.coursedoc.transcoder.content;

import java.util.List;
import java.util.Objects;

/**
 * Fragments of one paragraph plus the number of equations that had to be skipped.
 */
public record ParagraphExtraction(List<ParagraphFragment> fragments, int skippedEquations) {

    public ParagraphExtraction {
        fragments = List.copyOf(Objects.requireNonNull(fragments, "fragments"));
        if (skippedEquations < 0) {
            throw new IllegalArgumentException("skippedEquations must not be negative");
        }
    }
}
