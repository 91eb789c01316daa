package guraa.diagramwatch.scan;

import guraa.diagramwatch.model.BoundingBox;
import lombok.NonNull;
import lombok.Value;

/**
 * One positioned run of text as produced by the page scanner.
 */
@Value
public class TextPrimitive {
    @NonNull
    String text;
    @NonNull
    BoundingBox bbox;
    float fontSize;

    public double getCenterX() {
        return bbox.getCenterX();
    }

    public double getCenterY() {
        return bbox.getCenterY();
    }
}
