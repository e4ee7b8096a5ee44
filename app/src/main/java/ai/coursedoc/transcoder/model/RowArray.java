package ai.coursedoc.transcoder.model;

import java.util.Arrays;
import java.util.List;

/**
 * Vertically stacked rows: an aligned equation block, or a multi-line subscript.
 */
public record RowArray(List<MathNode> rows) implements MathNode {

    public RowArray {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static RowArray of(MathNode... rows) {
        return new RowArray(Arrays.asList(rows));
    }

    @Override
    public <R> R accept(MathNodeVisitor<R> visitor) {
        return visitor.visitRowArray(this);
    }
}
