package guraa.diagramwatch.scan;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the first page of a diagram PDF into raw primitives: positioned text spans and line segments.
 * No semantic filtering happens here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PdfPageScanner {

    private final PdfDocumentLoader documentLoader;

    /**
     * Scan the first page of a PDF file.
     *
     * @param pdfPath The PDF file
     * @return The page primitives
     * @throws DocumentNotFoundException If the file does not exist
     * @throws DocumentParseException If the file cannot be opened or its first page has no content
     */
    public PagePrimitives scan(Path pdfPath) throws DocumentNotFoundException, DocumentParseException {
        try (PDDocument document = documentLoader.load(pdfPath)) {
            return scan(document);
        } catch (DocumentNotFoundException | DocumentParseException e) {
            throw e;
        } catch (IOException e) {
            throw new DocumentParseException("Error reading " + pdfPath.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Scan the first page of an open document. The document stays open.
     *
     * @param document The PDF document
     * @return The page primitives
     * @throws DocumentParseException If the document has no pages or the first page has no content
     */
    public PagePrimitives scan(PDDocument document) throws DocumentParseException {
        if (document.getNumberOfPages() == 0) {
            throw new DocumentParseException("Document has no pages");
        }

        PDPage page = document.getPage(0);
        if (!page.hasContents()) {
            throw new DocumentParseException("First page has no content stream");
        }

        PDRectangle cropBox = page.getCropBox();
        try {
            PositionedSpanStripper stripper = new PositionedSpanStripper();
            stripper.setStartPage(1);
            stripper.setEndPage(1);
            stripper.getText(document);
            List<TextLine> textLines = stripper.getLines();

            List<LinePrimitive> lines = new LineSegmentCollector(page).collect();

            log.debug("Scanned page {} x {}: {} text lines, {} line segments",
                    cropBox.getWidth(), cropBox.getHeight(), textLines.size(), lines.size());

            return new PagePrimitives(cropBox.getWidth(), cropBox.getHeight(), textLines, lines);
        } catch (IOException | RuntimeException e) {
            throw new DocumentParseException("Failed to read page content: " + e.getMessage(), e);
        }
    }
}
