package ai.coursedoc.transcoder.model;

public record Superscript(MathNode base, MathNode exponent) implements MathNode {

    public Superscript {
        base = Group.orEmpty(base);
        exponent = Group.orEmpty(exponent);
    }

    @Override
    public <R> R accept(MathNodeVisitor<R> visitor) {
        return visitor.visitSuperscript(this);
    }
}
