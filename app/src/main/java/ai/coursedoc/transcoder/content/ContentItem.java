package ai.coursedoc.transcoder.content;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Objects;

/**
 * Content block as consumed by the JSON content pipeline. Exactly one of {@code text}, {@code equation}
 * and {@code items} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "type", "text", "equation", "items"})
public record ContentItem(String id, String type, String text, String equation, List<ContentItem> items) {

    public static final String TYPE_BODY = "body";
    public static final String TYPE_EQUATION = "equation";
    public static final String TYPE_PARAGRAPH = "paragraph";

    public ContentItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        items = items == null ? null : List.copyOf(items);
    }

    public static ContentItem text(String id, String type, String text) {
        return new ContentItem(id, type, Objects.requireNonNull(text, "text"), null, null);
    }

    public static ContentItem equation(String id, String equation) {
        return new ContentItem(id, TYPE_EQUATION, null, Objects.requireNonNull(equation, "equation"), null);
    }

    public static ContentItem paragraph(String id, List<ContentItem> items) {
        return new ContentItem(id, TYPE_PARAGRAPH, null, null, Objects.requireNonNull(items, "items"));
    }
}
