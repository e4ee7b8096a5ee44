package ai.coursedoc.transcoder.content;

import static org.assertj.core.api.Assertions.assertThat;

import ai.coursedoc.transcoder.model.Fraction;
import ai.coursedoc.transcoder.model.Group;
import ai.coursedoc.transcoder.model.TextRun;
import ai.coursedoc.transcoder.render.AlignmentBuilder;
import ai.coursedoc.transcoder.render.LatexTranscoder;
import java.util.List;
import org.junit.jupiter.api.Test;

class EquationRendererTest {

    private final EquationRenderer renderer = new EquationRenderer(new LatexTranscoder(), new AlignmentBuilder());

    @Test
    void inlineEquationIsTrimmed() {
        EquationSource source = new EquationSource.Inline(Group.of(
                new TextRun("  "), new Fraction(new TextRun("1"), new TextRun("2")), new TextRun(" ")));

        assertThat(renderer.render(source)).isEqualTo("\\frac{1}{2}");
    }

    @Test
    void displayRowsWithoutEqualsAreLeftAsIs() {
        EquationSource source = new EquationSource.Display(List.of(
                new TextRun("a+b=c"), new TextRun("x+y"), Group.empty()));

        assertThat(renderer.render(source)).isEqualTo("\\begin{aligned}\na+b&=c \\\\\nx+y\n\\end{aligned}");
    }

    @Test
    void displayWithOnlyEmptyRowsRendersNothing() {
        EquationSource source = new EquationSource.Display(List.of(Group.empty(), new TextRun(" ")));

        assertThat(renderer.render(source)).isEmpty();
    }
}
