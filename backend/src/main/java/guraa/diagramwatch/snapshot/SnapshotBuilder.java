package guraa.diagramwatch.snapshot;

import guraa.diagramwatch.classify.ClassifiedDiagram;
import guraa.diagramwatch.model.DiagramSnapshot;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Assembles classified page content and its identity into a {@link DiagramSnapshot}.
 */
@Component
public class SnapshotBuilder {

    public DiagramSnapshot build(ClassifiedDiagram diagram, String airportCode, String cycle, String sourceFile) {
        return DiagramSnapshot.builder()
                .airportCode(airportCode)
                .cycle(cycle)
                .sourceFile(sourceFile)
                .pageWidth(diagram.getPageWidth())
                .pageHeight(diagram.getPageHeight())
                .taxiwayLabels(diagram.getTaxiwayLabels())
                .runways(diagram.getRunwayExtraction().getRunways())
                .paths(diagram.getPaths())
                .rawRunwayText(List.of(diagram.getRunwayExtraction().getRawText()))
                .build();
    }
}
