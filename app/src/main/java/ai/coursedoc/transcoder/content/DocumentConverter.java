package ai.coursedoc.transcoder.content;

import ai.coursedoc.transcoder.docx.DocxDocument;
import ai.coursedoc.transcoder.docx.DocxParagraph;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts the body paragraphs of a document into content items.
 *
 * <p>When the document holds a {@code <teach>} marker paragraph, only the paragraphs after it are converted.
 * A {@code <revision>} or {@code <question>} marker ends the conversion. Marker paragraphs use the
 * {@code # Meta Data} style and are never emitted.
 */
public class DocumentConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentConverter.class);

    static final String START_MARKER = "<teach>";
    static final Set<String> STOP_MARKERS = Set.of("<revision>", "<question>");

    private final ParagraphContentExtractor extractor;
    private final ContentItemFactory itemFactory;

    public DocumentConverter(ParagraphContentExtractor extractor, ContentItemFactory itemFactory) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.itemFactory = Objects.requireNonNull(itemFactory, "itemFactory");
    }

    public ConversionResult convert(DocxDocument document) {
        Objects.requireNonNull(document, "document");
        List<ContentItem> content = new ArrayList<>();
        int skipped = 0;
        int equations = 0;
        boolean started = !hasStartMarker(document);
        for (DocxParagraph paragraph : document.paragraphs()) {
            ParagraphStyle style = ParagraphStyles.resolve(paragraph.styleName().orElse(null));
            if (style.treatment() == StyleTreatment.METADATA) {
                String marker = markerText(paragraph);
                if (STOP_MARKERS.contains(marker)) {
                    LOGGER.debug("Stopping at {} marker", marker);
                    break;
                }
                if (START_MARKER.equals(marker)) {
                    started = true;
                }
                continue;
            }
            if (!started) {
                continue;
            }
            ParagraphExtraction extraction = extractor.extract(paragraph.element());
            skipped += extraction.skippedEquations();
            equations += (int) extraction.fragments().stream()
                    .filter(fragment -> fragment.kind() == FragmentKind.EQUATION)
                    .count();
            switch (style.treatment()) {
                case CONTENT -> itemFactory.create(extraction.fragments(), style.contentType()).ifPresent(content::add);
                case LOOSE_TEXT_AND_EQUATIONS -> content.addAll(itemFactory.createLoose(extraction.fragments(), true));
                case LOOSE_EQUATIONS -> content.addAll(itemFactory.createLoose(extraction.fragments(), false));
                default -> throw new IllegalStateException("Unexpected treatment: " + style.treatment());
            }
        }
        LOGGER.info("Converted {} paragraphs of {} into {} content items ({} equations, {} skipped)",
                document.paragraphs().size(), document.source(), content.size(), equations, skipped);
        if (skipped > 0) {
            LOGGER.warn("{} equations could not be converted and were skipped", skipped);
        }
        return new ConversionResult(content, skipped);
    }

    private static boolean hasStartMarker(DocxDocument document) {
        return document.paragraphs().stream()
                .filter(paragraph -> ParagraphStyles.resolve(paragraph.styleName().orElse(null)).treatment()
                        == StyleTreatment.METADATA)
                .anyMatch(paragraph -> START_MARKER.equals(markerText(paragraph)));
    }

    private static String markerText(DocxParagraph paragraph) {
        return paragraph.element().getTextContent().strip().toLowerCase(Locale.ROOT);
    }
}
