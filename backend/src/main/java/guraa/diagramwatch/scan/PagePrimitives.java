package guraa.diagramwatch.scan;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raw content of one diagram page: positioned text grouped by line, and line segments.
 * Nothing here is filtered or interpreted.
 */
@Value
public class PagePrimitives {
    double pageWidth;
    double pageHeight;
    List<TextLine> textLines;
    List<LinePrimitive> lines;

    public PagePrimitives(double pageWidth, double pageHeight, List<TextLine> textLines, List<LinePrimitive> lines) {
        this.pageWidth = pageWidth;
        this.pageHeight = pageHeight;
        this.textLines = List.copyOf(textLines);
        this.lines = List.copyOf(lines);
    }

    /**
     * Every text span on the page, line by line.
     */
    public List<TextPrimitive> getTextSpans() {
        return textLines.stream()
                .flatMap(line -> line.getSpans().stream())
                .collect(Collectors.toList());
    }

    /**
     * Page text with one line per text line.
     */
    public String getFullText() {
        return textLines.stream().map(TextLine::getText).collect(Collectors.joining("\n"));
    }
}
