package ai.coursedoc.transcoder.content;

import ai.coursedoc.transcoder.model.MathNode;
import ai.coursedoc.transcoder.render.AlignmentBuilder;
import ai.coursedoc.transcoder.render.LatexTranscoder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns equation sources into the text stored in {@code equation} content items.
 */
public class EquationRenderer {

    private final LatexTranscoder transcoder;
    private final AlignmentBuilder alignmentBuilder;

    public EquationRenderer(LatexTranscoder transcoder, AlignmentBuilder alignmentBuilder) {
        this.transcoder = Objects.requireNonNull(transcoder, "transcoder");
        this.alignmentBuilder = Objects.requireNonNull(alignmentBuilder, "alignmentBuilder");
    }

    /**
     * Renders the source; an empty result means there is nothing worth emitting.
     */
    public String render(EquationSource source) {
        if (source instanceof EquationSource.Inline inline) {
            return transcoder.transcode(inline.root());
        }
        EquationSource.Display display = (EquationSource.Display) source;
        List<String> rows = new ArrayList<>(display.rows().size());
        for (MathNode row : display.rows()) {
            String rendered = transcoder.transcode(row);
            if (!rendered.isEmpty()) {
                rows.add(rendered);
            }
        }
        return alignmentBuilder.combine(rows);
    }
}
