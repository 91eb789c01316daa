package guraa.diagramwatch.snapshot;

import guraa.diagramwatch.model.DiagramSnapshot;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Result of extracting a snapshot from a document. Only {@link ExtractionStatus#EXTRACTED}
 * carries a snapshot; failures carry a message instead and never a partial snapshot.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExtractionResult {
    ExtractionStatus status;
    DiagramSnapshot snapshot;
    String message;

    public static ExtractionResult extracted(DiagramSnapshot snapshot) {
        return new ExtractionResult(ExtractionStatus.EXTRACTED, snapshot, null);
    }

    public static ExtractionResult notFound(String message) {
        return new ExtractionResult(ExtractionStatus.DOCUMENT_NOT_FOUND, null, message);
    }

    public static ExtractionResult parseFailure(String message) {
        return new ExtractionResult(ExtractionStatus.PARSE_FAILURE, null, message);
    }

    public boolean isExtracted() {
        return status == ExtractionStatus.EXTRACTED;
    }

    public Optional<DiagramSnapshot> getSnapshot() {
        return Optional.ofNullable(snapshot);
    }
}
