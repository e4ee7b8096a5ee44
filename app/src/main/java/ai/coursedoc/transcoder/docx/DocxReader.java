package ai.coursedoc.transcoder.docx;

import ai.coursedoc.transcoder.omml.OmmlNamespaces;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Reads the body paragraphs of a {@code .docx} package, or of a bare {@code document.xml} part.
 */
public class DocxReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocxReader.class);

    static final String DOCUMENT_PART = "word/document.xml";
    static final String STYLES_PART = "word/styles.xml";

    public DocxDocument read(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path must be provided");
        }
        if (!Files.isRegularFile(path)) {
            throw new DocumentReadException("Input document does not exist: " + path);
        }
        try {
            if (isPackage(path)) {
                return readPackage(path);
            }
            try (InputStream input = Files.newInputStream(path)) {
                Document document = parse(input, path.toString());
                return new DocxDocument(path, paragraphs(document, Map.of()));
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read document: " + path, ex);
        }
    }

    private DocxDocument readPackage(Path path) throws IOException {
        try (ZipFile zip = new ZipFile(path.toFile())) {
            ZipEntry documentEntry = zip.getEntry(DOCUMENT_PART);
            if (documentEntry == null) {
                throw new DocumentReadException("Not a Word document, " + DOCUMENT_PART + " is missing: " + path);
            }
            Map<String, String> styleNames = Map.of();
            ZipEntry stylesEntry = zip.getEntry(STYLES_PART);
            if (stylesEntry != null) {
                try (InputStream input = zip.getInputStream(stylesEntry)) {
                    styleNames = styleNames(parse(input, STYLES_PART));
                }
            } else {
                LOGGER.debug("{} has no {}, style ids are used as names", path, STYLES_PART);
            }
            try (InputStream input = zip.getInputStream(documentEntry)) {
                return new DocxDocument(path, paragraphs(parse(input, DOCUMENT_PART), styleNames));
            }
        }
    }

    private List<DocxParagraph> paragraphs(Document document, Map<String, String> styleNames) {
        NodeList bodies = document.getElementsByTagNameNS(OmmlNamespaces.WORDPROCESSING, "body");
        if (bodies.getLength() == 0) {
            throw new DocumentReadException("Document has no body element");
        }
        List<DocxParagraph> paragraphs = new ArrayList<>();
        for (Element paragraph : wordChildren((Element) bodies.item(0), "p")) {
            Optional<String> styleName = styleId(paragraph)
                    .map(id -> styleNames.getOrDefault(id, id));
            paragraphs.add(new DocxParagraph(paragraph, styleName));
        }
        return paragraphs;
    }

    private static Optional<String> styleId(Element paragraph) {
        for (Element properties : wordChildren(paragraph, "pPr")) {
            for (Element style : wordChildren(properties, "pStyle")) {
                String value = style.getAttributeNS(OmmlNamespaces.WORDPROCESSING, "val");
                if (!value.isBlank()) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }

    private static Map<String, String> styleNames(Document styles) {
        Map<String, String> names = new HashMap<>();
        NodeList elements = styles.getElementsByTagNameNS(OmmlNamespaces.WORDPROCESSING, "style");
        for (int i = 0; i < elements.getLength(); i++) {
            Element style = (Element) elements.item(i);
            String id = style.getAttributeNS(OmmlNamespaces.WORDPROCESSING, "styleId");
            if (id.isBlank()) {
                continue;
            }
            for (Element name : wordChildren(style, "name")) {
                names.put(id, name.getAttributeNS(OmmlNamespaces.WORDPROCESSING, "val"));
            }
        }
        return names;
    }

    private static List<Element> wordChildren(Element parent, String localName) {
        List<Element> elements = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Element element
                    && OmmlNamespaces.WORDPROCESSING.equals(element.getNamespaceURI())
                    && localName.equals(element.getLocalName())) {
                elements.add(element);
            }
        }
        return elements;
    }

    private static boolean isPackage(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".docx");
    }

    private static Document parse(InputStream input, String name) throws IOException {
        try {
            return newDocumentBuilder().parse(input);
        } catch (SAXException ex) {
            throw new DocumentReadException("Malformed XML in " + name, ex);
        }
    }

    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser is not available", ex);
        }
    }
}
