package ai.coursedoc.transcoder.omml;

/**
 * XML namespaces of Office Open XML parts handled by the transcoder.
 */
public final class OmmlNamespaces {

    public static final String MATH = "http://schemas.openxmlformats.org/officeDocument/2006/math";
    public static final String WORDPROCESSING = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";

    private OmmlNamespaces() {
    }
}
