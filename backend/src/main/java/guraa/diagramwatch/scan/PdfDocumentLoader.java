package guraa.diagramwatch.scan;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.io.MemoryUsageSetting;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens diagram PDFs, retrying with temp-file buffering when the in-memory load fails.
 */
@Slf4j
@Component
public class PdfDocumentLoader {

    /**
     * Load a PDF document.
     *
     * @param path The PDF file
     * @return The open document; the caller closes it
     * @throws DocumentNotFoundException If the file does not exist
     * @throws DocumentParseException If no loading strategy could open the file
     */
    public PDDocument load(Path path) throws DocumentNotFoundException, DocumentParseException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new DocumentNotFoundException(path);
        }

        // First attempt: standard loading
        try {
            return PDDocument.load(path.toFile());
        } catch (InvalidPasswordException e) {
            throw new DocumentParseException("Document is password protected: " + path.getFileName(), e);
        } catch (Exception e) {
            log.warn("Standard PDF loading failed for {}: {}. Trying with temp-file buffering...",
                    path.getFileName(), e.getMessage());
        }

        // Second attempt: buffer through temp files, tolerates large or odd streams better
        try {
            return PDDocument.load(path.toFile(), MemoryUsageSetting.setupTempFileOnly());
        } catch (Exception e) {
            log.warn("Temp-file buffered loading failed for {}: {}", path.getFileName(), e.getMessage());
            throw new DocumentParseException("Failed to load PDF document " + path.getFileName()
                    + ". The file may be corrupted or use unsupported features.", e);
        }
    }
}
