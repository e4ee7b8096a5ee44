package ai.coursedoc.transcoder.omml;

/**
 * Runtime exception used when an Office Math element cannot be turned into a math tree.
 */
public class OmmlParseException extends RuntimeException {

    public OmmlParseException(String message) {
        super(message);
    }
}
