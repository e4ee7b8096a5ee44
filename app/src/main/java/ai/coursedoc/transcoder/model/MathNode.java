package ai.coursedoc.transcoder.model;

/**
 * Immutable node of a parsed math expression tree.
 *
 * <p>The hierarchy is closed: every kind is listed in {@code permits} and in
 * {@link MathNodeVisitor}, so adding a kind forces every renderer to handle it.
 */
public sealed interface MathNode
        permits Fraction, Superscript, Subscript, SubSup, Radical, Function, NAryOperator,
        Delimiter, RowArray, TextRun, Group, UnknownElement {

    <R> R accept(MathNodeVisitor<R> visitor);
}
