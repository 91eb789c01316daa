package guraa.diagramwatch.classify;

import guraa.diagramwatch.scan.PagePrimitives;
import guraa.diagramwatch.scan.TextLine;
import lombok.Value;

import java.awt.geom.Point2D;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Page text prepared for runway extraction: the full text plus the position of every
 * runway-sized dimension string, keyed by its (length, width) pair.
 */
@Value
public class RunwayTextContext {

    /**
     * Dimension text such as "12000 X 150".
     */
    static final Pattern DIMENSION_PATTERN = Pattern.compile("(\\d{4,5})\\s*[Xx]\\s*(\\d{2,3})");

    /**
     * Shorter dimensions belong to pads, aprons and the like.
     */
    static final int MIN_RUNWAY_LENGTH_FT = 2000;

    private static final Point2D UNLOCATED = new Point2D.Double(0, 0);

    String fullText;
    Map<DimensionKey, Point2D> dimensionPositions;

    public RunwayTextContext(String fullText, Map<DimensionKey, Point2D> dimensionPositions) {
        this.fullText = fullText;
        this.dimensionPositions = Map.copyOf(dimensionPositions);
    }

    /**
     * Build the context from scanned page content. When the same dimensions appear more
     * than once, the first line on the page wins.
     */
    public static RunwayTextContext from(PagePrimitives page) {
        Map<DimensionKey, Point2D> positions = new HashMap<>();

        for (TextLine line : page.getTextLines()) {
            Matcher matcher = DIMENSION_PATTERN.matcher(line.getText());
            while (matcher.find()) {
                int length = Integer.parseInt(matcher.group(1));
                int width = Integer.parseInt(matcher.group(2));
                if (length < MIN_RUNWAY_LENGTH_FT) {
                    continue;
                }
                positions.putIfAbsent(new DimensionKey(length, width),
                        new Point2D.Double(line.getBounds().getCenterX(), line.getBounds().getCenterY()));
            }
        }

        return new RunwayTextContext(page.getFullText(), positions);
    }

    /**
     * Position of the dimension text, or (0, 0) when it was not seen on a single line.
     */
    public Point2D positionOf(int lengthFt, int widthFt) {
        return dimensionPositions.getOrDefault(new DimensionKey(lengthFt, widthFt), UNLOCATED);
    }

    @Value
    public static class DimensionKey {
        int lengthFt;
        int widthFt;
    }
}
