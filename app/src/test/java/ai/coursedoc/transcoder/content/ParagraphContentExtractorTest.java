package ai.coursedoc.transcoder.content;

import static ai.coursedoc.transcoder.XmlFixtures.paragraph;
import static ai.coursedoc.transcoder.XmlFixtures.run;
import static org.assertj.core.api.Assertions.assertThat;

import ai.coursedoc.transcoder.omml.OmmlParser;
import ai.coursedoc.transcoder.render.AlignmentBuilder;
import ai.coursedoc.transcoder.render.LatexTranscoder;
import ai.coursedoc.transcoder.render.SummationHeuristic;
import org.junit.jupiter.api.Test;

class ParagraphContentExtractorTest {

    private static final String FRACTION = "<m:oMath><m:f><m:num>" + run("d") + "</m:num>"
            + "<m:den>" + run("t") + "</m:den></m:f></m:oMath>";

    private final ParagraphContentExtractor extractor = extractor(256, 256);

    @Test
    void keepsTextAndInlineEquationsInDocumentOrder() {
        ParagraphExtraction extraction = extractor.extract(paragraph(
                "<w:r><w:t xml:space=\"preserve\">Speed is </w:t></w:r>"
                        + FRACTION
                        + "<w:r><w:t xml:space=\"preserve\"> in m/s</w:t></w:r>"));

        assertThat(extraction.fragments()).containsExactly(
                ParagraphFragment.text("Speed is"),
                ParagraphFragment.equation("\\frac{d}{t}"),
                ParagraphFragment.text("in m/s"));
        assertThat(extraction.skippedEquations()).isZero();
    }

    @Test
    void marksBoldRunsAndJoinsConsecutiveRuns() {
        ParagraphExtraction extraction = extractor.extract(paragraph(
                "<w:r><w:rPr><w:b/></w:rPr><w:t>Note</w:t></w:r>"
                        + "<w:r><w:rPr><w:b w:val=\"false\"/></w:rPr><w:t>: mass is </w:t></w:r>"
                        + "<w:hyperlink><w:r><w:t>conserved</w:t></w:r></w:hyperlink>"));

        assertThat(extraction.fragments()).containsExactly(ParagraphFragment.text("**Note**: mass is conserved"));
    }

    @Test
    void equationInsideRunIsExtracted() {
        ParagraphExtraction extraction = extractor.extract(paragraph("<w:r>" + FRACTION + "</w:r>"));

        assertThat(extraction.fragments()).containsExactly(ParagraphFragment.equation("\\frac{d}{t}"));
    }

    @Test
    void displayBlockRowsAreAligned() {
        ParagraphExtraction extraction = extractor.extract(paragraph("<m:oMathPara>"
                + "<m:oMath>" + run("y=2x") + "</m:oMath>"
                + "<m:oMath>" + run("=4") + "</m:oMath>"
                + "<m:oMath/>"
                + "</m:oMathPara>"));

        assertThat(extraction.fragments()).containsExactly(
                ParagraphFragment.equation("\\begin{aligned}\ny&=2x \\\\\n&=4\n\\end{aligned}"));
    }

    @Test
    void singleRowDisplayBlockIsNotWrapped() {
        ParagraphExtraction extraction = extractor.extract(paragraph("<m:oMathPara>"
                + "<m:oMath>" + run(" F = ma ") + "</m:oMath></m:oMathPara>"));

        assertThat(extraction.fragments()).containsExactly(ParagraphFragment.equation("F = ma"));
    }

    @Test
    void unparseableEquationIsSkippedAndCounted() {
        ParagraphContentExtractor shallowParser = extractor(2, 256);

        ParagraphExtraction extraction = shallowParser.extract(paragraph(
                "<w:r><w:t>Ratio</w:t></w:r>" + FRACTION));

        assertThat(extraction.fragments()).containsExactly(ParagraphFragment.text("Ratio"));
        assertThat(extraction.skippedEquations()).isEqualTo(1);
    }

    @Test
    void unrenderableEquationIsSkippedAndCounted() {
        ParagraphContentExtractor shallowRenderer = extractor(256, 2);

        ParagraphExtraction extraction = shallowRenderer.extract(paragraph(FRACTION + FRACTION));

        assertThat(extraction.fragments()).isEmpty();
        assertThat(extraction.skippedEquations()).isEqualTo(2);
    }

    @Test
    void emptyEquationsProduceNoFragment() {
        ParagraphExtraction extraction = extractor.extract(paragraph("<m:oMath/><w:r><w:t>  </w:t></w:r>"));

        assertThat(extraction.fragments()).isEmpty();
        assertThat(extraction.skippedEquations()).isZero();
    }

    private static ParagraphContentExtractor extractor(int parserDepth, int renderDepth) {
        LatexTranscoder transcoder = new LatexTranscoder(SummationHeuristic.PERMISSIVE, renderDepth);
        return new ParagraphContentExtractor(new OmmlParser(parserDepth),
                new EquationRenderer(transcoder, new AlignmentBuilder()));
    }
}
