package guraa.diagramwatch.scan;

import guraa.diagramwatch.model.BoundingBox;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Spans that share a baseline, in reading order.
 */
@Value
public class TextLine {
    List<TextPrimitive> spans;

    public TextLine(List<TextPrimitive> spans) {
        this.spans = List.copyOf(spans);
    }

    /**
     * Span texts joined by a single space.
     */
    public String getText() {
        return spans.stream().map(TextPrimitive::getText).collect(Collectors.joining(" "));
    }

    /**
     * Box enclosing every span of the line, or {@link BoundingBox#EMPTY} for an empty line.
     */
    public BoundingBox getBounds() {
        return spans.stream()
                .map(TextPrimitive::getBbox)
                .reduce(BoundingBox::union)
                .orElse(BoundingBox.EMPTY);
    }
}
