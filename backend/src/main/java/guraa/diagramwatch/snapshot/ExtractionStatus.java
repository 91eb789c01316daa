package guraa.diagramwatch.snapshot;

/**
 * Outcome of one extraction attempt.
 */
public enum ExtractionStatus {
    EXTRACTED,
    DOCUMENT_NOT_FOUND,
    PARSE_FAILURE
}
