package ai.coursedoc.transcoder.model;

import java.util.Optional;

/**
 * Bracketed expression. Without explicit bracket characters it stands for auto-sized parentheses.
 */
public record Delimiter(MathNode inner, Optional<String> begin, Optional<String> end) implements MathNode {

    public Delimiter {
        inner = Group.orEmpty(inner);
        begin = begin == null ? Optional.empty() : begin;
        end = end == null ? Optional.empty() : end;
    }

    public static Delimiter parenthesized(MathNode inner) {
        return new Delimiter(inner, Optional.empty(), Optional.empty());
    }

    public boolean hasExplicitBrackets() {
        return begin.isPresent() || end.isPresent();
    }

    @Override
    public <R> R accept(MathNodeVisitor<R> visitor) {
        return visitor.visitDelimiter(this);
    }
}
