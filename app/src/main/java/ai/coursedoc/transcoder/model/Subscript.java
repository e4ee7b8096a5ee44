package ai.coursedoc.transcoder.model;

/**
 * Base with a subscript. The subscript may itself be a {@link RowArray} (a multi-line subscript).
 */
public record Subscript(MathNode base, MathNode subscript) implements MathNode {

    public Subscript {
        base = Group.orEmpty(base);
        subscript = Group.orEmpty(subscript);
    }

    @Override
    public <R> R accept(MathNodeVisitor<R> visitor) {
        return visitor.visitSubscript(this);
    }
}
