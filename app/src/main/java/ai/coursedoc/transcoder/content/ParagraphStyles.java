package ai.coursedoc.transcoder.content;

import java.util.Map;
import java.util.Set;

/**
 * Maps Word paragraph style names to how their content is emitted.
 */
public final class ParagraphStyles {

    static final String METADATA_STYLE = "# Meta Data";

    private static final Map<String, String> CONTENT_TYPES = Map.of(
            "# Body", "body",
            "# Bullet-1", "bullet1",
            "# Bullet-2", "bullet2",
            "# Sub Topic - 3", "sub-topic-3",
            "# Highlight Red", "highlight-red",
            "# Highlight Brown", "highlight-brown",
            "# Highlight Blue", "highlight-blue",
            "# Highlight Green", "highlight-green");

    private static final Set<String> TEXT_CARRYING_STYLES = Set.of("# Highlight", "# Headline", "# Body Equation");

    private ParagraphStyles() {
    }

    public static ParagraphStyle resolve(String styleName) {
        String name = styleName == null ? "" : styleName.trim();
        String contentType = CONTENT_TYPES.get(name);
        if (contentType != null) {
            return new ParagraphStyle(StyleTreatment.CONTENT, contentType);
        }
        if (METADATA_STYLE.equals(name)) {
            return new ParagraphStyle(StyleTreatment.METADATA, ContentItem.TYPE_BODY);
        }
        if (TEXT_CARRYING_STYLES.contains(name)) {
            return new ParagraphStyle(StyleTreatment.LOOSE_TEXT_AND_EQUATIONS, ContentItem.TYPE_BODY);
        }
        return new ParagraphStyle(StyleTreatment.LOOSE_EQUATIONS, ContentItem.TYPE_BODY);
    }
}
