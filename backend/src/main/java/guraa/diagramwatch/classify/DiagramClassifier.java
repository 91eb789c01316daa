package guraa.diagramwatch.classify;

import guraa.diagramwatch.model.PathSegment;
import guraa.diagramwatch.model.TaxiwayLabel;
import guraa.diagramwatch.scan.PagePrimitives;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the taxiway, runway and geometry classifiers over one scanned page.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiagramClassifier {

    private final TaxiwayLabelClassifier taxiwayLabelClassifier;
    private final RunwayClassifier runwayClassifier;
    private final GeometryClassifier geometryClassifier;

    public ClassifiedDiagram classify(PagePrimitives page) {
        DiagramBounds bounds = DiagramBounds.forPage(page.getPageWidth(), page.getPageHeight());
        log.debug("Diagram bounds: ({}, {}) to ({}, {})",
                Math.round(bounds.getMinX()), Math.round(bounds.getMinY()),
                Math.round(bounds.getMaxX()), Math.round(bounds.getMaxY()));

        List<TaxiwayLabel> labels = taxiwayLabelClassifier.classify(page.getTextSpans(), bounds);
        RunwayExtraction runways = runwayClassifier.classify(page);
        List<PathSegment> paths = geometryClassifier.classify(page.getLines(), bounds);

        return new ClassifiedDiagram(page.getPageWidth(), page.getPageHeight(), bounds, labels, runways, paths);
    }
}
