package guraa.diagramwatch.scan;

import org.apache.pdfbox.contentstream.PDFGraphicsStreamEngine;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImage;
import org.apache.pdfbox.util.Matrix;

import java.awt.geom.Point2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the straight "lineTo" segments of every painted path on a page.
 * Rectangles, curves and images are skipped. Points are converted to display
 * coordinates (origin top-left of the crop box).
 */
class LineSegmentCollector extends PDFGraphicsStreamEngine {

    private final PDRectangle cropBox;
    private final List<LinePrimitive> segments = new ArrayList<>();
    private final List<Point2D[]> pendingSegments = new ArrayList<>();
    private Point2D currentPoint;

    LineSegmentCollector(PDPage page) {
        super(page);
        this.cropBox = page.getCropBox();
    }

    List<LinePrimitive> collect() throws IOException {
        segments.clear();
        processPage(getPage());
        return segments;
    }

    @Override
    public void appendRectangle(Point2D p0, Point2D p1, Point2D p2, Point2D p3) {
        // rectangles are area fills, not line primitives
        currentPoint = p0;
    }

    @Override
    public void drawImage(PDImage pdImage) {
        // ignore raster images
    }

    @Override
    public void clip(int windingRule) {
        // ignore clipping
    }

    @Override
    public void moveTo(float x, float y) {
        currentPoint = new Point2D.Float(x, y);
    }

    @Override
    public void lineTo(float x, float y) {
        Point2D end = new Point2D.Float(x, y);
        if (currentPoint != null) {
            pendingSegments.add(new Point2D[]{currentPoint, end});
        }
        currentPoint = end;
    }

    @Override
    public void curveTo(float x1, float y1, float x2, float y2, float x3, float y3) {
        currentPoint = new Point2D.Float(x3, y3);
    }

    @Override
    public Point2D getCurrentPoint() {
        return currentPoint;
    }

    @Override
    public void closePath() {
        // the implicit closing edge is not reported as a line
    }

    @Override
    public void endPath() {
        pendingSegments.clear();
        currentPoint = null;
    }

    @Override
    public void strokePath() {
        registerPendingSegments();
    }

    @Override
    public void fillPath(int windingRule) {
        registerPendingSegments();
    }

    @Override
    public void fillAndStrokePath(int windingRule) {
        registerPendingSegments();
    }

    @Override
    public void shadingFill(COSName shadingName) {
        // ignore shading
    }

    private void registerPendingSegments() {
        if (!pendingSegments.isEmpty()) {
            Matrix ctm = getGraphicsState().getCurrentTransformationMatrix();
            double width = getGraphicsState().getLineWidth() * Math.abs(ctm.getScalingFactorX());

            for (Point2D[] segment : pendingSegments) {
                segments.add(new LinePrimitive(
                        toDisplayX(segment[0]), toDisplayY(segment[0]),
                        toDisplayX(segment[1]), toDisplayY(segment[1]),
                        width));
            }
        }
        pendingSegments.clear();
        currentPoint = null;
    }

    private double toDisplayX(Point2D point) {
        return point.getX() - cropBox.getLowerLeftX();
    }

    private double toDisplayY(Point2D point) {
        // PDF user space has its origin at the bottom-left
        return cropBox.getUpperRightY() - point.getY();
    }
}
