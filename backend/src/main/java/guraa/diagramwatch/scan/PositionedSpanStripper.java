package guraa.diagramwatch.scan;

import guraa.diagramwatch.model.BoundingBox;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * PDFTextStripper that keeps each word it writes as a positioned span, grouped by output line.
 * Coordinates are display coordinates: origin at the top-left of the crop box.
 */
class PositionedSpanStripper extends PDFTextStripper {

    private final List<TextLine> lines = new ArrayList<>();
    private List<TextPrimitive> currentLine = new ArrayList<>();

    PositionedSpanStripper() throws IOException {
        super();
        setSortByPosition(true);
    }

    List<TextLine> getLines() {
        return lines;
    }

    @Override
    protected void startPage(PDPage page) throws IOException {
        super.startPage(page);
        lines.clear();
        currentLine = new ArrayList<>();
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        super.writeString(text, textPositions);
        TextPrimitive span = toSpan(text, textPositions);
        if (span != null) {
            currentLine.add(span);
        }
    }

    @Override
    protected void writeLineSeparator() throws IOException {
        super.writeLineSeparator();
        flushLine();
    }

    @Override
    protected void endPage(PDPage page) throws IOException {
        flushLine();
        super.endPage(page);
    }

    private void flushLine() {
        if (!currentLine.isEmpty()) {
            lines.add(new TextLine(currentLine));
            currentLine = new ArrayList<>();
        }
    }

    private static TextPrimitive toSpan(String text, List<TextPosition> positions) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty() || positions == null || positions.isEmpty()) {
            return null;
        }

        float minX = Float.MAX_VALUE;
        float minY = Float.MAX_VALUE;
        float maxX = -Float.MAX_VALUE;
        float maxY = -Float.MAX_VALUE;
        float fontSize = 0;

        for (TextPosition position : positions) {
            if (position == null) continue;

            // YDirAdj is the baseline in display space; the glyph extends upward by its height
            float x = position.getXDirAdj();
            float baseline = position.getYDirAdj();
            minX = Math.min(minX, x);
            maxX = Math.max(maxX, x + position.getWidthDirAdj());
            minY = Math.min(minY, baseline - position.getHeightDir());
            maxY = Math.max(maxY, baseline);

            if (fontSize == 0) {
                fontSize = position.getFontSizeInPt();
            }
        }

        if (minX > maxX || minY > maxY) {
            return null;
        }
        return new TextPrimitive(trimmed, new BoundingBox(minX, minY, maxX, maxY), fontSize);
    }
}
