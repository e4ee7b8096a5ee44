package ai.coursedoc.transcoder.model;

import java.util.Optional;

/**
 * Root of a radicand. A missing degree, or one that renders blank, means a square root.
 */
public record Radical(Optional<MathNode> degree, MathNode radicand) implements MathNode {

    public Radical {
        degree = degree == null ? Optional.empty() : degree;
        radicand = Group.orEmpty(radicand);
    }

    public static Radical squareRoot(MathNode radicand) {
        return new Radical(Optional.empty(), radicand);
    }

    @Override
    public <R> R accept(MathNodeVisitor<R> visitor) {
        return visitor.visitRadical(this);
    }
}
