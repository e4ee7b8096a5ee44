package ai.coursedoc.transcoder.model;

import java.util.List;

/**
 * Markup element without a dedicated kind (accents, bars, boxes, ...). Kept so its content is not lost.
 */
public record UnknownElement(String tag, List<MathNode> children) implements MathNode {

    public UnknownElement {
        tag = tag == null ? "" : tag;
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public <R> R accept(MathNodeVisitor<R> visitor) {
        return visitor.visitUnknown(this);
    }
}
