package guraa.diagramwatch.scan;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The source document is missing.
 */
public class DocumentNotFoundException extends IOException {

    private final transient Path path;

    public DocumentNotFoundException(Path path) {
        super("File not found: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
