package ai.coursedoc.transcoder.content;

import ai.coursedoc.transcoder.model.MathNode;
import java.util.List;
import java.util.Objects;

/**
 * Equation roots found in a paragraph: one inline expression, or the sibling rows of one display block.
 */
public sealed interface EquationSource permits EquationSource.Inline, EquationSource.Display {

    record Inline(MathNode root) implements EquationSource {

        public Inline {
            Objects.requireNonNull(root, "root");
        }
    }

    record Display(List<MathNode> rows) implements EquationSource {

        public Display {
            rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
        }
    }
}
