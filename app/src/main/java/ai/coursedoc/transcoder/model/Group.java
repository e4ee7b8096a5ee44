package ai.coursedoc.transcoder.model;

import java.util.Arrays;
import java.util.List;

/**
 * Ordered concatenation of child expressions.
 */
public record Group(List<MathNode> children) implements MathNode {

    private static final Group EMPTY = new Group(List.of());

    public Group {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static Group empty() {
        return EMPTY;
    }

    public static Group of(MathNode... children) {
        return new Group(Arrays.asList(children));
    }

    /**
     * Returns the given node, or an empty group when it is {@code null}.
     */
    static MathNode orEmpty(MathNode node) {
        return node == null ? EMPTY : node;
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    @Override
    public <R> R accept(MathNodeVisitor<R> visitor) {
        return visitor.visitGroup(this);
    }
}
