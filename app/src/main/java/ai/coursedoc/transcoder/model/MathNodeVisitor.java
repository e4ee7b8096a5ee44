package ai.coursedoc.transcoder.model;

/**
 * Visitor with one method per {@link MathNode} kind.
 */
public interface MathNodeVisitor<R> {

    R visitFraction(Fraction node);

    R visitSuperscript(Superscript node);

    R visitSubscript(Subscript node);

    R visitSubSup(SubSup node);

    R visitRadical(Radical node);

    R visitFunction(Function node);

    R visitNAryOperator(NAryOperator node);

    R visitDelimiter(Delimiter node);

    R visitRowArray(RowArray node);

    R visitTextRun(TextRun node);

    R visitGroup(Group node);

    R visitUnknown(UnknownElement node);
}
