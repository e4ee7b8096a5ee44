package ai.coursedoc.transcoder.model;

public record SubSup(MathNode base, MathNode subscript, MathNode exponent) implements MathNode {

    public SubSup {
        base = Group.orEmpty(base);
        subscript = Group.orEmpty(subscript);
        exponent = Group.orEmpty(exponent);
    }

    @Override
    public <R> R accept(MathNodeVisitor<R> visitor) {
        return visitor.visitSubSup(this);
    }
}
