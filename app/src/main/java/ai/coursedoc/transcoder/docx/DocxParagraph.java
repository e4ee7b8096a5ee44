package ai.coursedoc.transcoder.docx;

import java.util.Objects;
import java.util.Optional;
import org.w3c.dom.Element;

/**
 * Body paragraph ({@code w:p}) with its resolved style name.
 */
public record DocxParagraph(Element element, Optional<String> styleName) {

    public DocxParagraph {
        Objects.requireNonNull(element, "element");
        styleName = styleName == null ? Optional.empty() : styleName;
    }
}
