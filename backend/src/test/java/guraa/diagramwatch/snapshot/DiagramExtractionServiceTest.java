package guraa.diagramwatch.snapshot;

import guraa.diagramwatch.classify.DiagramClassifier;
import guraa.diagramwatch.classify.GeometryClassifier;
import guraa.diagramwatch.classify.RunwayClassifier;
import guraa.diagramwatch.classify.TaxiwayLabelClassifier;
import guraa.diagramwatch.model.DiagramSnapshot;
import guraa.diagramwatch.model.RunwayRecord;
import guraa.diagramwatch.model.TaxiwayLabel;
import guraa.diagramwatch.scan.DiagramPdfFixtures;
import guraa.diagramwatch.scan.PdfDocumentLoader;
import guraa.diagramwatch.scan.PdfPageScanner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class DiagramExtractionServiceTest {

    @TempDir
    Path tempDir;

    private final DiagramExtractionService service = new DiagramExtractionService(
            new PdfPageScanner(new PdfDocumentLoader()),
            new DiagramClassifier(new TaxiwayLabelClassifier(), new RunwayClassifier(), new GeometryClassifier()),
            new SnapshotBuilder());

    @Test
    void extractBuildsSnapshotNamedAfterTheFile() throws IOException {
        Path pdf = DiagramPdfFixtures.writeSampleDiagram(tempDir.resolve("JFK_2602.pdf"));

        ExtractionResult result = service.extract(pdf);

        assertThat(result.getStatus()).isEqualTo(ExtractionStatus.EXTRACTED);
        DiagramSnapshot snapshot = result.getSnapshot().orElseThrow();
        assertThat(snapshot.getAirportCode()).isEqualTo("JFK");
        assertThat(snapshot.getCycle()).isEqualTo("2602");
        assertThat(snapshot.getSourceFile()).isEqualTo(pdf.toString());
        assertThat(snapshot.getPageWidth()).isEqualTo(612.0);
        assertThat(snapshot.getTaxiwayLabels()).extracting(TaxiwayLabel::getDesignator).containsExactly("B", "A");
        assertThat(snapshot.getRunways())
                .extracting(RunwayRecord::getDesignator, RunwayRecord::getLengthFt, RunwayRecord::getWidthFt)
                .containsExactly(tuple("4L/22R", 12079, 200));
        assertThat(snapshot.getPaths()).hasSize(1);
        assertThat(snapshot.getRawRunwayText()).hasSize(1);
        assertThat(snapshot.getRawRunwayText().get(0)).contains("12079 X 200");
    }

    @Test
    void explicitAirportAndCycleOverrideTheFileName() throws IOException {
        Path pdf = DiagramPdfFixtures.writeSampleDiagram(tempDir.resolve("diagram.pdf"));

        ExtractionResult result = service.extract(pdf, "LGA", "2513");

        DiagramSnapshot snapshot = result.getSnapshot().orElseThrow();
        assertThat(snapshot.getAirportCode()).isEqualTo("LGA");
        assertThat(snapshot.getCycle()).isEqualTo("2513");
    }

    @Test
    void missingFileIsReportedAsNotFound() {
        ExtractionResult result = service.extract(tempDir.resolve("EWR_2601.pdf"));

        assertThat(result.getStatus()).isEqualTo(ExtractionStatus.DOCUMENT_NOT_FOUND);
        assertThat(result.isExtracted()).isFalse();
        assertThat(result.getSnapshot()).isEmpty();
    }

    @Test
    void unreadableFileIsReportedAsParseFailure() throws IOException {
        Path garbage = Files.write(tempDir.resolve("EWR_2601.pdf"), "%PDF-garbage".getBytes(StandardCharsets.UTF_8));

        ExtractionResult result = service.extract(garbage);

        assertThat(result.getStatus()).isEqualTo(ExtractionStatus.PARSE_FAILURE);
        assertThat(result.getSnapshot()).isEmpty();
        assertThat(result.getMessage()).isNotBlank();
    }
}
