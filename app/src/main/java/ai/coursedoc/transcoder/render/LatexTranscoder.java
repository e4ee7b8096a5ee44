package ai.coursedoc.transcoder.render;

import ai.coursedoc.transcoder.model.Delimiter;
import ai.coursedoc.transcoder.model.Fraction;
import ai.coursedoc.transcoder.model.Function;
import ai.coursedoc.transcoder.model.Group;
import ai.coursedoc.transcoder.model.MathNode;
import ai.coursedoc.transcoder.model.MathNodeVisitor;
import ai.coursedoc.transcoder.model.NAryOperator;
import ai.coursedoc.transcoder.model.Radical;
import ai.coursedoc.transcoder.model.RowArray;
import ai.coursedoc.transcoder.model.SubSup;
import ai.coursedoc.transcoder.model.Subscript;
import ai.coursedoc.transcoder.model.Superscript;
import ai.coursedoc.transcoder.model.TextRun;
import ai.coursedoc.transcoder.model.UnknownElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders math trees as LaTeX text.
 *
 * <p>Instances are immutable and may be shared between threads; every call walks the tree with its own
 * depth counter and allocates nothing that outlives the call.
 */
public class LatexTranscoder {

    public static final int DEFAULT_MAX_DEPTH = 256;

    private static final String NAMED_OPERATOR_ESCAPE = "\\";

    private final SummationHeuristic summationHeuristic;
    private final int maxDepth;
    private final AlignmentBuilder alignmentBuilder = new AlignmentBuilder();

    public LatexTranscoder() {
        this(SummationHeuristic.PERMISSIVE, DEFAULT_MAX_DEPTH);
    }

    public LatexTranscoder(SummationHeuristic summationHeuristic, int maxDepth) {
        this.summationHeuristic = Objects.requireNonNull(summationHeuristic, "summationHeuristic");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1");
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Renders a node verbatim. Never fails for trees within the depth ceiling.
     *
     * @throws TranscodingException when the tree nests deeper than the configured ceiling
     */
    public String render(MathNode node) {
        if (node == null) {
            return "";
        }
        return new RenderPass().render(node);
    }

    /**
     * Renders the root of one equation, trimmed as it is embedded in content items.
     */
    public String transcode(MathNode root) {
        return render(root).strip();
    }

    public SummationHeuristic summationHeuristic() {
        return summationHeuristic;
    }

    private final class RenderPass implements MathNodeVisitor<String> {

        private int depth;

        String render(MathNode node) {
            if (++depth > maxDepth) {
                throw new TranscodingException("Math tree nests deeper than " + maxDepth + " levels");
            }
            try {
                return node.accept(this);
            } finally {
                depth--;
            }
        }

        @Override
        public String visitFraction(Fraction node) {
            return "\\frac{" + render(node.numerator()) + "}{" + render(node.denominator()) + "}";
        }

        @Override
        public String visitSuperscript(Superscript node) {
            return render(node.base()) + "^{" + render(node.exponent()) + "}";
        }

        /**
         * A subscript holding an equation array renders as {@code \substack}; content beside the array is dropped.
         */
        @Override
        public String visitSubscript(Subscript node) {
            String base = render(node.base());
            String subscript = stackedRows(node.subscript())
                    .orElseGet(() -> render(node.subscript()));
            return base + "_{" + subscript + "}";
        }

        @Override
        public String visitSubSup(SubSup node) {
            return render(node.base()) + "_{" + render(node.subscript()) + "}^{" + render(node.exponent()) + "}";
        }

        @Override
        public String visitRadical(Radical node) {
            String radicand = render(node.radicand());
            String degree = node.degree().map(this::render).orElse("");
            if (degree.isBlank()) {
                return "\\sqrt{" + radicand + "}";
            }
            return "\\sqrt[" + degree + "]{" + radicand + "}";
        }

        @Override
        public String visitFunction(Function node) {
            String name = render(node.name());
            if (!name.isEmpty() && !name.startsWith(NAMED_OPERATOR_ESCAPE)) {
                name = NAMED_OPERATOR_ESCAPE + name;
            }
            return name + render(node.argument());
        }

        @Override
        public String visitNAryOperator(NAryOperator node) {
            String lower = node.lowerLimit().map(this::render).orElse("");
            String upper = node.upperLimit().map(this::render).orElse("");

            NaryOperatorSymbol symbol = node.operatorChar()
                    .map(NaryOperatorSymbol::fromCharacter)
                    .orElse(NaryOperatorSymbol.SUM);
            boolean plainSummation = node.operatorChar()
                    .map(NaryOperatorSymbol.SUM.character()::equals)
                    .orElse(true);
            if (plainSummation && node.lowerLimit().isPresent() && node.upperLimit().isPresent()
                    && summationHeuristic.treatAsIntegral(lower, upper)) {
                symbol = NaryOperatorSymbol.INTEGRAL;
            }

            StringBuilder builder = new StringBuilder(symbol.command());
            if (!lower.isEmpty()) {
                builder.append("_{").append(lower).append('}');
            }
            if (!upper.isEmpty()) {
                builder.append("^{").append(upper).append('}');
            }
            builder.append(render(node.operand()));
            return builder.toString();
        }

        @Override
        public String visitDelimiter(Delimiter node) {
            String content = render(node.inner());
            if (node.hasExplicitBrackets()) {
                return node.begin().orElse("(") + content + node.end().orElse(")");
            }
            return "\\left(" + content + "\\right)";
        }

        @Override
        public String visitRowArray(RowArray node) {
            return alignmentBuilder.alignArrayRows(renderAll(node.rows()));
        }

        @Override
        public String visitTextRun(TextRun node) {
            return node.text();
        }

        @Override
        public String visitGroup(Group node) {
            return concat(node.children());
        }

        @Override
        public String visitUnknown(UnknownElement node) {
            return concat(node.children());
        }

        private Optional<String> stackedRows(MathNode subscript) {
            Optional<RowArray> array = findRowArray(subscript);
            if (array.isEmpty()) {
                return Optional.empty();
            }
            List<String> rows = new ArrayList<>();
            for (String row : renderAll(array.get().rows())) {
                if (!row.isEmpty()) {
                    rows.add(row);
                }
            }
            if (rows.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of("\\substack{" + String.join(" \\\\ ", rows) + "}");
        }

        private Optional<RowArray> findRowArray(MathNode node) {
            if (node instanceof RowArray array) {
                return Optional.of(array);
            }
            if (node instanceof Group group) {
                return group.children().stream()
                        .filter(RowArray.class::isInstance)
                        .map(RowArray.class::cast)
                        .findFirst();
            }
            return Optional.empty();
        }

        private List<String> renderAll(List<MathNode> nodes) {
            List<String> rendered = new ArrayList<>(nodes.size());
            for (MathNode node : nodes) {
                rendered.add(render(node));
            }
            return rendered;
        }

        private String concat(List<MathNode> children) {
            StringBuilder builder = new StringBuilder();
            for (MathNode child : children) {
                builder.append(render(child));
            }
            return builder.toString();
        }
    }
}
