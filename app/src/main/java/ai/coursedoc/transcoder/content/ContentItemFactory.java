package ai.coursedoc.transcoder.content;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds content items from the fragments of one paragraph.
 *
 * <p>A lone text fragment keeps the paragraph's content type and a lone equation becomes an equation item.
 * Anything else is wrapped in a {@code paragraph} item whose text children are plain body items.
 * Paragraphs of other styles yield loose top-level items instead, see {@link #createLoose}.
 */
public class ContentItemFactory {

    private final IdGenerator idGenerator;

    public ContentItemFactory(IdGenerator idGenerator) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    public Optional<ContentItem> create(List<ParagraphFragment> fragments, String contentType) {
        if (fragments == null || fragments.isEmpty()) {
            return Optional.empty();
        }
        if (fragments.size() == 1) {
            return Optional.of(toItem(fragments.get(0), contentType));
        }
        List<ContentItem> items = new ArrayList<>(fragments.size());
        for (ParagraphFragment fragment : fragments) {
            items.add(toItem(fragment, ContentItem.TYPE_BODY));
        }
        return Optional.of(ContentItem.paragraph(idGenerator.nextId(), items));
    }

    /**
     * Emits each equation as its own item, and each text fragment as a body item when {@code keepText} is set.
     */
    public List<ContentItem> createLoose(List<ParagraphFragment> fragments, boolean keepText) {
        if (fragments == null || fragments.isEmpty()) {
            return List.of();
        }
        List<ContentItem> items = new ArrayList<>(fragments.size());
        for (ParagraphFragment fragment : fragments) {
            if (fragment.kind() == FragmentKind.EQUATION || keepText) {
                items.add(toItem(fragment, ContentItem.TYPE_BODY));
            }
        }
        return items;
    }

    private ContentItem toItem(ParagraphFragment fragment, String textType) {
        return switch (fragment.kind()) {
            case TEXT -> ContentItem.text(idGenerator.nextId(), textType, fragment.value());
            case EQUATION -> ContentItem.equation(idGenerator.nextId(), fragment.value());
        };
    }
}
