package ai.coursedoc.transcoder.content;

/**
 * How the content of a paragraph is emitted, decided by its style.
 */
public enum StyleTreatment {
    /** Content style: one item, or a paragraph wrapper for mixed content. */
    CONTENT,
    /** Other style known to carry text: text and equations as separate top-level items. */
    LOOSE_TEXT_AND_EQUATIONS,
    /** Any other style: only equations, as separate top-level items. */
    LOOSE_EQUATIONS,
    /** Control paragraphs ({@code <teach>}, {@code <revision>}, ...), never content. */
    METADATA
}
