package guraa.diagramwatch.classify;

import lombok.Value;

/**
 * The part of the page that holds the surface diagram itself.
 * FAA diagrams keep the title on top, notes at the bottom and legends on the sides,
 * so fixed proportional margins are cut away.
 */
@Value
public class DiagramBounds {

    static final double HORIZONTAL_MARGIN = 0.12;
    static final double TOP_MARGIN = 0.10;
    static final double BOTTOM_MARGIN = 0.08;

    double minX;
    double minY;
    double maxX;
    double maxY;

    /**
     * Compute the interior bounds for a page of the given size.
     */
    public static DiagramBounds forPage(double pageWidth, double pageHeight) {
        double marginX = pageWidth * HORIZONTAL_MARGIN;
        return new DiagramBounds(
                marginX,
                pageHeight * TOP_MARGIN,
                pageWidth - marginX,
                pageHeight - pageHeight * BOTTOM_MARGIN);
    }

    /**
     * Whether a point lies strictly inside the bounds; points on the edge are outside.
     */
    public boolean contains(double x, double y) {
        return minX < x && x < maxX && minY < y && y < maxY;
    }
}
