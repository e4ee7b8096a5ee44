package ai.coursedoc.transcoder.docx;

/**
 * Runtime exception used when a Word document or one of its XML parts cannot be read.
 */
public class DocumentReadException extends RuntimeException {

    public DocumentReadException(String message) {
        super(message);
    }

    public DocumentReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
