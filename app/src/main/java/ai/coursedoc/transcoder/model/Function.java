package ai.coursedoc.transcoder.model;

/**
 * Named function (sin, log, lim, ...) applied to an argument.
 */
public record Function(MathNode name, MathNode argument) implements MathNode {

    public Function {
        name = Group.orEmpty(name);
        argument = Group.orEmpty(argument);
    }

    @Override
    public <R> R accept(MathNodeVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}
