package guraa.diagramwatch.scan;

import java.io.IOException;

/**
 * The document exists but could not be read as a diagram page.
 */
public class DocumentParseException extends IOException {

    public DocumentParseException(String message) {
        super(message);
    }

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
