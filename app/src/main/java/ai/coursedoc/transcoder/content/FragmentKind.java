package ai.coursedoc.transcoder.content;

/**
 * Kind of a piece of paragraph content.
 */
public enum FragmentKind {
    TEXT,
    EQUATION
}
