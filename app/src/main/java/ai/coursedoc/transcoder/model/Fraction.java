package ai.coursedoc.transcoder.model;

public record Fraction(MathNode numerator, MathNode denominator) implements MathNode {

    public Fraction {
        numerator = Group.orEmpty(numerator);
        denominator = Group.orEmpty(denominator);
    }

    @Override
    public <R> R accept(MathNodeVisitor<R> visitor) {
        return visitor.visitFraction(this);
    }
}
