package guraa.diagramwatch.classify;

import guraa.diagramwatch.model.PathSegment;
import guraa.diagramwatch.scan.LinePrimitive;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Keeps the line segments that lie entirely inside the diagram interior.
 */
@Component
public class GeometryClassifier {

    public List<PathSegment> classify(List<LinePrimitive> lines, DiagramBounds bounds) {
        return lines.stream()
                .filter(line -> bounds.contains(line.getX0(), line.getY0())
                        && bounds.contains(line.getX1(), line.getY1()))
                .map(line -> new PathSegment(line.getX0(), line.getY0(), line.getX1(), line.getY1(),
                        line.getStrokeWidth()))
                .collect(Collectors.toList());
    }
}
