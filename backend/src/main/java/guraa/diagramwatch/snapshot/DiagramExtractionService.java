package guraa.diagramwatch.snapshot;

import guraa.diagramwatch.classify.ClassifiedDiagram;
import guraa.diagramwatch.classify.DiagramClassifier;
import guraa.diagramwatch.model.DiagramSnapshot;
import guraa.diagramwatch.model.RunwayRecord;
import guraa.diagramwatch.scan.DocumentNotFoundException;
import guraa.diagramwatch.scan.DocumentParseException;
import guraa.diagramwatch.scan.PagePrimitives;
import guraa.diagramwatch.scan.PdfPageScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * Turns one airport diagram PDF into a {@link DiagramSnapshot}: scan, classify, assemble.
 * Missing or unreadable documents are reported through the {@link ExtractionResult}, never thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiagramExtractionService {

    private final PdfPageScanner pageScanner;
    private final DiagramClassifier classifier;
    private final SnapshotBuilder snapshotBuilder;

    /**
     * Extract a snapshot, taking airport code and cycle from the file name.
     *
     * @param pdfPath The diagram PDF, named like {@code JFK_2602.pdf}
     * @return The extraction result
     */
    public ExtractionResult extract(Path pdfPath) {
        SourceName name = SourceName.parse(pdfPath);
        return extract(pdfPath, name.getAirportCode(), name.getCycle());
    }

    /**
     * Extract a snapshot for an explicit airport and cycle.
     *
     * @param pdfPath The diagram PDF
     * @param airportCode The airport code
     * @param cycle The AIRAC cycle
     * @return The extraction result
     */
    public ExtractionResult extract(Path pdfPath, String airportCode, String cycle) {
        log.info("Extracting {} cycle {} from {}", airportCode, cycle, pdfPath);

        PagePrimitives page;
        try {
            page = pageScanner.scan(pdfPath);
        } catch (DocumentNotFoundException e) {
            log.warn("Diagram not found: {}", pdfPath);
            return ExtractionResult.notFound(e.getMessage());
        } catch (DocumentParseException e) {
            log.warn("Error reading diagram {}: {}", pdfPath, e.getMessage());
            return ExtractionResult.parseFailure(e.getMessage());
        }

        ClassifiedDiagram diagram = classifier.classify(page);
        DiagramSnapshot snapshot = snapshotBuilder.build(diagram, airportCode, cycle, pdfPath.toString());
        logSummary(snapshot, diagram);
        return ExtractionResult.extracted(snapshot);
    }

    private void logSummary(DiagramSnapshot snapshot, ClassifiedDiagram diagram) {
        log.info("Page size: {} x {}", Math.round(snapshot.getPageWidth()), Math.round(snapshot.getPageHeight()));
        log.info("Taxiway labels: {}, runways found: {} (tier {}), vector paths: {}",
                snapshot.getTaxiwayLabels().size(),
                snapshot.getRunways().size(),
                diagram.getRunwayExtraction().getTier(),
                snapshot.getPaths().size());
        log.info("Unique designators: {}",
                snapshot.getDesignators().stream().sorted().collect(Collectors.joining(", ")));

        if (log.isDebugEnabled()) {
            for (RunwayRecord runway : snapshot.getRunways()) {
                log.debug("  {}: {} x {} ft", runway.getDesignator(), runway.getLengthFt(), runway.getWidthFt());
            }
        }
    }
}
