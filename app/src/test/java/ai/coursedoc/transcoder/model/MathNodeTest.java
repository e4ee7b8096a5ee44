package ai.coursedoc.transcoder.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class MathNodeTest {

    @Test
    void missingChildrenBecomeEmptyGroups() {
        Fraction fraction = new Fraction(null, null);
        SubSup subSup = new SubSup(null, TextRun.of("i"), null);

        assertThat(fraction.numerator()).isEqualTo(Group.empty());
        assertThat(fraction.denominator()).isEqualTo(Group.empty());
        assertThat(subSup.base()).isEqualTo(Group.empty());
        assertThat(subSup.exponent()).isEqualTo(Group.empty());
    }

    @Test
    void optionalChildrenDefaultToEmpty() {
        NAryOperator nary = new NAryOperator(null, null, null, null);
        Radical radical = new Radical(null, TextRun.of("x"));

        assertThat(nary.operatorChar()).isEmpty();
        assertThat(nary.lowerLimit()).isEmpty();
        assertThat(nary.upperLimit()).isEmpty();
        assertThat(nary.operand()).isEqualTo(Group.empty());
        assertThat(radical.degree()).isEmpty();
    }

    @Test
    void childListsAreCopiedAndUnmodifiable() {
        List<MathNode> children = new ArrayList<>(List.of(TextRun.of("a")));
        Group group = new Group(children);
        children.add(TextRun.of("b"));

        assertThat(group.children()).containsExactly(TextRun.of("a"));
        assertThatThrownBy(() -> group.children().add(TextRun.of("c")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nullTextBecomesEmpty() {
        assertThat(TextRun.of(null).text()).isEmpty();
    }

    @Test
    void delimiterReportsExplicitBrackets() {
        assertThat(Delimiter.parenthesized(TextRun.of("x")).hasExplicitBrackets()).isFalse();
        assertThat(new Delimiter(TextRun.of("x"), Optional.empty(), Optional.of("]")).hasExplicitBrackets()).isTrue();
    }

    @Test
    void visitorDispatchesOnKind() {
        MathNodeVisitor<String> kindNames = new KindNameVisitor();

        assertThat(RowArray.of(TextRun.of("a")).accept(kindNames)).isEqualTo("rows");
        assertThat(new UnknownElement("bar", List.of()).accept(kindNames)).isEqualTo("unknown:bar");
        assertThat(Group.of().accept(kindNames)).isEqualTo("group");
    }

    private static final class KindNameVisitor implements MathNodeVisitor<String> {

        @Override
        public String visitFraction(Fraction node) {
            return "fraction";
        }

        @Override
        public String visitSuperscript(Superscript node) {
            return "sup";
        }

        @Override
        public String visitSubscript(Subscript node) {
            return "sub";
        }

        @Override
        public String visitSubSup(SubSup node) {
            return "subsup";
        }

        @Override
        public String visitRadical(Radical node) {
            return "radical";
        }

        @Override
        public String visitFunction(Function node) {
            return "function";
        }

        @Override
        public String visitNAryOperator(NAryOperator node) {
            return "nary";
        }

        @Override
        public String visitDelimiter(Delimiter node) {
            return "delimiter";
        }

        @Override
        public String visitRowArray(RowArray node) {
            return "rows";
        }

        @Override
        public String visitTextRun(TextRun node) {
            return "text";
        }

        @Override
        public String visitGroup(Group node) {
            return "group";
        }

        @Override
        public String visitUnknown(UnknownElement node) {
            return "unknown:" + node.tag();
        }
    }
}
