package guraa.diagramwatch.classify;

import guraa.diagramwatch.model.PathSegment;
import guraa.diagramwatch.model.TaxiwayLabel;
import lombok.Value;

import java.util.List;

/**
 * The semantic content of one page, ready to be assembled into a snapshot.
 */
@Value
public class ClassifiedDiagram {
    double pageWidth;
    double pageHeight;
    DiagramBounds bounds;
    List<TaxiwayLabel> taxiwayLabels;
    RunwayExtraction runwayExtraction;
    List<PathSegment> paths;
}
