package ai.coursedoc.transcoder.content;

import java.util.Objects;

/**
 * Rendered piece of a paragraph, kept in document order.
 */
public record ParagraphFragment(FragmentKind kind, String value) {

    public ParagraphFragment {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
    }

    public static ParagraphFragment text(String value) {
        return new ParagraphFragment(FragmentKind.TEXT, value);
    }

    public static ParagraphFragment equation(String value) {
        return new ParagraphFragment(FragmentKind.EQUATION, value);
    }
}
