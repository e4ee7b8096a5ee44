package ai.coursedoc.transcoder.omml;

import ai.coursedoc.transcoder.model.Delimiter;
import ai.coursedoc.transcoder.model.Fraction;
import ai.coursedoc.transcoder.model.Function;
import ai.coursedoc.transcoder.model.Group;
import ai.coursedoc.transcoder.model.MathNode;
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
import java.util.Optional;
import java.util.Set;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Converts Office Math (OMML) DOM elements into {@link MathNode} trees.
 */
public class OmmlParser {

    static final String DEFAULT_OPERATOR_CHAR = "\u2211";
    static final String DEFAULT_SEPARATOR = "|";

    private static final Set<String> CONTAINERS = Set.of(
            "oMath", "oMathPara", "e", "num", "den", "sub", "sup", "deg", "fName", "lim");

    private final int maxDepth;

    public OmmlParser(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1");
        }
        this.maxDepth = maxDepth;
    }

    public MathNode parse(Element element) {
        if (element == null) {
            throw new OmmlParseException("No math element given");
        }
        if (!OmmlNamespaces.MATH.equals(element.getNamespaceURI())) {
            throw new OmmlParseException("Not an Office Math element: " + element.getNodeName());
        }
        return parseElement(element, 1);
    }

    private MathNode parseElement(Element element, int depth) {
        if (depth > maxDepth) {
            throw new OmmlParseException("Math markup nests deeper than " + maxDepth + " levels");
        }
        String tag = element.getLocalName();
        int next = depth + 1;
        switch (tag) {
            case "f":
                return new Fraction(child(element, "num", next), child(element, "den", next));
            case "sSup":
                return new Superscript(child(element, "e", next), child(element, "sup", next));
            case "sSub":
                return new Subscript(child(element, "e", next), child(element, "sub", next));
            case "sSubSup":
                return new SubSup(child(element, "e", next), child(element, "sub", next), child(element, "sup", next));
            case "rad":
                return new Radical(optionalChild(element, "deg", next), child(element, "e", next));
            case "func":
                return new Function(child(element, "fName", next), child(element, "e", next));
            case "eqArr":
                return new RowArray(children(element, "e", next));
            case "nary":
                return parseNary(element, next);
            case "d":
                return parseDelimiter(element, next);
            case "r":
                return new TextRun(runText(element));
            case "t":
                return new TextRun(element.getTextContent());
            default:
                List<MathNode> content = contentChildren(element, next);
                if (CONTAINERS.contains(tag)) {
                    return new Group(content);
                }
                return new UnknownElement(tag, content);
        }
    }

    private MathNode parseNary(Element element, int depth) {
        Optional<String> operatorChar = firstMathChild(element, "naryPr")
                .flatMap(properties -> firstMathChild(properties, "chr"))
                .map(chr -> attribute(chr, "val").orElse(DEFAULT_OPERATOR_CHAR));
        return new NAryOperator(operatorChar,
                optionalChild(element, "sub", depth),
                optionalChild(element, "sup", depth),
                child(element, "e", depth));
    }

    private MathNode parseDelimiter(Element element, int depth) {
        Optional<Element> properties = firstMathChild(element, "dPr");
        String separator = properties
                .flatMap(dPr -> firstMathChild(dPr, "sepChr"))
                .flatMap(sepChr -> attribute(sepChr, "val"))
                .orElse(DEFAULT_SEPARATOR);

        List<MathNode> parts = children(element, "e", depth);
        MathNode inner;
        if (parts.size() == 1) {
            inner = parts.get(0);
        } else {
            List<MathNode> joined = new ArrayList<>();
            for (int i = 0; i < parts.size(); i++) {
                if (i > 0) {
                    joined.add(new TextRun(separator));
                }
                joined.add(parts.get(i));
            }
            inner = new Group(joined);
        }

        if (properties.isEmpty()) {
            return Delimiter.parenthesized(inner);
        }
        String begin = properties.flatMap(dPr -> firstMathChild(dPr, "begChr"))
                .map(chr -> attribute(chr, "val").orElse("("))
                .orElse("(");
        String end = properties.flatMap(dPr -> firstMathChild(dPr, "endChr"))
                .map(chr -> attribute(chr, "val").orElse(")"))
                .orElse(")");
        return new Delimiter(inner, Optional.of(begin), Optional.of(end));
    }

    private MathNode child(Element parent, String name, int depth) {
        return optionalChild(parent, name, depth).orElse(Group.empty());
    }

    private Optional<MathNode> optionalChild(Element parent, String name, int depth) {
        return firstMathChild(parent, name).map(element -> parseElement(element, depth));
    }

    private List<MathNode> children(Element parent, String name, int depth) {
        List<MathNode> nodes = new ArrayList<>();
        for (Element element : mathChildren(parent)) {
            if (name.equals(element.getLocalName())) {
                nodes.add(parseElement(element, depth));
            }
        }
        return nodes;
    }

    private List<MathNode> contentChildren(Element parent, int depth) {
        List<MathNode> nodes = new ArrayList<>();
        for (Element element : mathChildren(parent)) {
            if (!isProperties(element)) {
                nodes.add(parseElement(element, depth));
            }
        }
        return nodes;
    }

    private static String runText(Element run) {
        StringBuilder builder = new StringBuilder();
        for (Element element : mathChildren(run)) {
            if ("t".equals(element.getLocalName())) {
                builder.append(element.getTextContent());
            }
        }
        return builder.toString();
    }

    private static boolean isProperties(Element element) {
        return element.getLocalName().endsWith("Pr");
    }

    private static Optional<String> attribute(Element element, String name) {
        if (!element.hasAttributeNS(OmmlNamespaces.MATH, name)) {
            return Optional.empty();
        }
        return Optional.of(element.getAttributeNS(OmmlNamespaces.MATH, name));
    }

    private static Optional<Element> firstMathChild(Element parent, String name) {
        for (Element element : mathChildren(parent)) {
            if (name.equals(element.getLocalName())) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    private static List<Element> mathChildren(Element parent) {
        List<Element> elements = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Element element && OmmlNamespaces.MATH.equals(element.getNamespaceURI())) {
                elements.add(element);
            }
        }
        return elements;
    }
}
