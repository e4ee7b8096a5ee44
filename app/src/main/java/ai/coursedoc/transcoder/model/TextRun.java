package ai.coursedoc.transcoder.model;

/**
 * Literal text leaf.
 */
public record TextRun(String text) implements MathNode {

    public TextRun {
        text = text == null ? "" : text;
    }

    public static TextRun of(String text) {
        return new TextRun(text);
    }

    @Override
    public <R> R accept(MathNodeVisitor<R> visitor) {
        return visitor.visitTextRun(this);
    }
}
