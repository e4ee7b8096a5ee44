package ai.coursedoc.transcoder.content;

import ai.coursedoc.transcoder.model.MathNode;
import ai.coursedoc.transcoder.omml.OmmlNamespaces;
import ai.coursedoc.transcoder.omml.OmmlParseException;
import ai.coursedoc.transcoder.omml.OmmlParser;
import ai.coursedoc.transcoder.render.TranscodingException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Extracts text and equations from a WordprocessingML paragraph ({@code w:p}) in document order.
 *
 * <p>Text of consecutive runs is buffered and flushed, trimmed, whenever an equation starts. Bold runs are
 * wrapped in {@code **}. Equations that cannot be parsed or rendered are skipped and counted.
 */
public class ParagraphContentExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ParagraphContentExtractor.class);
    private static final Set<String> BOLD_OFF_VALUES = Set.of("false", "0", "off");

    private final OmmlParser parser;
    private final EquationRenderer equationRenderer;

    public ParagraphContentExtractor(OmmlParser parser, EquationRenderer equationRenderer) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.equationRenderer = Objects.requireNonNull(equationRenderer, "equationRenderer");
    }

    public ParagraphExtraction extract(Element paragraph) {
        Objects.requireNonNull(paragraph, "paragraph");
        Collector collector = new Collector();
        walk(paragraph, collector);
        collector.flushText();
        return new ParagraphExtraction(collector.fragments, collector.skipped);
    }

    private void walk(Element parent, Collector collector) {
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (!(node instanceof Element element)) {
                continue;
            }
            String namespace = element.getNamespaceURI();
            String name = element.getLocalName();
            if (OmmlNamespaces.WORDPROCESSING.equals(namespace)) {
                if ("r".equals(name)) {
                    handleRun(element, collector);
                } else if ("hyperlink".equals(name)) {
                    walk(element, collector);
                }
            } else if (OmmlNamespaces.MATH.equals(namespace)) {
                if ("oMath".equals(name)) {
                    collector.flushText();
                    addInline(element, collector);
                } else if ("oMathPara".equals(name)) {
                    collector.flushText();
                    List<MathNode> rows = parseRows(childElements(element, OmmlNamespaces.MATH, "oMath"), collector);
                    if (!rows.isEmpty()) {
                        collector.addEquation(new EquationSource.Display(rows));
                    }
                }
            }
        }
    }

    private void handleRun(Element run, Collector collector) {
        NodeList maths = run.getElementsByTagNameNS(OmmlNamespaces.MATH, "oMath");
        if (maths.getLength() > 0) {
            collector.flushText();
            addInline((Element) maths.item(0), collector);
            return;
        }
        String text = runText(run);
        if (text.isEmpty()) {
            return;
        }
        collector.text.append(isBold(run) ? "**" + text + "**" : text);
    }

    private void addInline(Element math, Collector collector) {
        List<MathNode> rows = parseRows(List.of(math), collector);
        if (!rows.isEmpty()) {
            collector.addEquation(new EquationSource.Inline(rows.get(0)));
        }
    }

    private List<MathNode> parseRows(List<Element> elements, Collector collector) {
        List<MathNode> rows = new ArrayList<>(elements.size());
        for (Element element : elements) {
            try {
                rows.add(parser.parse(element));
            } catch (OmmlParseException ex) {
                LOGGER.warn("Skipping equation that could not be parsed: {}", ex.getMessage());
                collector.skipped++;
            }
        }
        return rows;
    }

    private static String runText(Element run) {
        StringBuilder builder = new StringBuilder();
        NodeList texts = run.getElementsByTagNameNS(OmmlNamespaces.WORDPROCESSING, "t");
        for (int i = 0; i < texts.getLength(); i++) {
            builder.append(texts.item(i).getTextContent());
        }
        return builder.toString();
    }

    private static boolean isBold(Element run) {
        for (Element properties : childElements(run, OmmlNamespaces.WORDPROCESSING, "rPr")) {
            for (Element bold : childElements(properties, OmmlNamespaces.WORDPROCESSING, "b")) {
                if (!bold.hasAttributeNS(OmmlNamespaces.WORDPROCESSING, "val")) {
                    return true;
                }
                String value = bold.getAttributeNS(OmmlNamespaces.WORDPROCESSING, "val");
                return !BOLD_OFF_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
            }
        }
        return false;
    }

    private static List<Element> childElements(Element parent, String namespace, String localName) {
        List<Element> elements = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Element element
                    && namespace.equals(element.getNamespaceURI())
                    && localName.equals(element.getLocalName())) {
                elements.add(element);
            }
        }
        return elements;
    }

    private final class Collector {

        private final List<ParagraphFragment> fragments = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();
        private int skipped;

        void flushText() {
            String content = text.toString().strip();
            if (!content.isEmpty()) {
                fragments.add(ParagraphFragment.text(content));
            }
            text.setLength(0);
        }

        void addEquation(EquationSource source) {
            try {
                String latex = equationRenderer.render(source);
                if (!latex.isEmpty()) {
                    fragments.add(ParagraphFragment.equation(latex));
                }
            } catch (TranscodingException ex) {
                LOGGER.warn("Skipping equation that could not be rendered: {}", ex.getMessage());
                skipped++;
            }
        }
    }
}
