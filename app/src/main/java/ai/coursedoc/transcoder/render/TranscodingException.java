package ai.coursedoc.transcoder.render;

/**
 * Runtime exception raised when a math tree cannot be rendered at all, e.g. when it nests deeper than allowed.
 */
public class TranscodingException extends RuntimeException {

    public TranscodingException(String message) {
        super(message);
    }
}
