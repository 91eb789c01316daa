package guraa.diagramwatch.report;

import guraa.diagramwatch.compare.ComparisonResult;
import guraa.diagramwatch.compare.DiagramComparisonEngine;
import guraa.diagramwatch.model.DiagramSnapshot;
import guraa.diagramwatch.model.RunwayRecord;
import guraa.diagramwatch.model.TaxiwayLabel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChangeReportFormatterTest {

    private final ChangeReportFormatter formatter = new ChangeReportFormatter();
    private final DiagramComparisonEngine engine = DiagramComparisonEngine.createDefault();

    @Test
    void reportListsChangesBySection() {
        DiagramSnapshot before = DiagramSnapshot.builder()
                .airportCode("JFK").cycle("2601")
                .taxiwayLabels(List.of(label("A", 100, 100)))
                .runways(List.of(runway(7200)))
                .build();
        DiagramSnapshot after = DiagramSnapshot.builder()
                .airportCode("JFK").cycle("2602")
                .taxiwayLabels(List.of(label("A", 100, 100), label("YA", 250.4, 310.6)))
                .runways(List.of(runway(7499)))
                .build();

        String report = formatter.format(engine.compare(before, after));

        assertThat(report)
                .contains("AIRPORT DIAGRAM CHANGE REPORT")
                .contains("Airport:        JFK")
                .contains("Old Cycle:      2601")
                .contains("New Cycle:      2602")
                .contains("  Taxiways added:   1")
                .contains("Taxiway Changes:")
                .contains("  [ADDED   ] New taxiway 'YA' added")
                .contains("             Location: (250, 311)")
                .contains("Runway Changes:")
                .contains("  [LENGTH_CHANGED ] Runway 10/28 extended by 299 ft (7200 → 7499 ft)")
                .doesNotContain("Geometry Changes:")
                .doesNotContain(ChangeReportFormatter.NO_CHANGES);
    }

    @Test
    void reportWithoutChangesSaysSo() {
        DiagramSnapshot snapshot = DiagramSnapshot.builder()
                .airportCode("LGA").cycle("2601")
                .taxiwayLabels(List.of(label("A", 100, 100)))
                .build();

        ComparisonResult result = engine.compare(snapshot, snapshot);
        String report = formatter.format(result);

        assertThat(report).contains(ChangeReportFormatter.NO_CHANGES);
        assertThat(report).contains("  Old diagram: 1 unique taxiway designators");
        assertThat(report).endsWith(ChangeReportFormatter.RULE + "\n");
    }

    private static TaxiwayLabel label(String designator, double x, double y) {
        return TaxiwayLabel.builder().designator(designator).x(x).y(y).build();
    }

    private static RunwayRecord runway(int length) {
        return RunwayRecord.builder().designator("10/28").lengthFt(length).widthFt(150).build();
    }
}
