package guraa.diagramwatch.scan;

import lombok.Value;

/**
 * A straight line drawn on the page, in page space, with the stroke width in effect.
 */
@Value
public class LinePrimitive {
    double x0;
    double y0;
    double x1;
    double y1;
    double strokeWidth;
}
