package guraa.diagramwatch.classify;

import guraa.diagramwatch.model.PathSegment;
import guraa.diagramwatch.scan.LinePrimitive;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GeometryClassifierTest {

    private final GeometryClassifier classifier = new GeometryClassifier();

    @Test
    void keepsOnlySegmentsWithBothEndpointsInside() {
        DiagramBounds bounds = DiagramBounds.forPage(1000, 1000);
        List<LinePrimitive> lines = List.of(
                new LinePrimitive(200, 200, 800, 200, 1.5),
                new LinePrimitive(200, 200, 900, 200, 1.0),
                new LinePrimitive(50, 50, 500, 500, 1.0));

        List<PathSegment> paths = classifier.classify(lines, bounds);

        assertThat(paths).containsExactly(new PathSegment(200, 200, 800, 200, 1.5));
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        assertThat(classifier.classify(List.of(), DiagramBounds.forPage(612, 792))).isEmpty();
    }
}
