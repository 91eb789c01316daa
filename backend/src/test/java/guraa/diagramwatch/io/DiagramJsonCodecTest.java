package guraa.diagramwatch.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import guraa.diagramwatch.compare.ComparisonResult;
import guraa.diagramwatch.compare.DiagramComparisonEngine;
import guraa.diagramwatch.model.BoundingBox;
import guraa.diagramwatch.model.DiagramSnapshot;
import guraa.diagramwatch.model.RunwayRecord;
import guraa.diagramwatch.model.TaxiwayLabel;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiagramJsonCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DiagramJsonCodec codec = new DiagramJsonCodec(objectMapper);

    @Test
    void readSnapshotUsesSnakeCaseKeys() throws IOException {
        String json = "{"
                + "\"airport_code\": \"JFK\", \"cycle\": \"2602\", \"source_file\": \"JFK_2602.pdf\","
                + "\"page_width\": 612.0, \"page_height\": 792.0,"
                + "\"taxiway_labels\": [{\"designator\": \"B\", \"x\": 300.5, \"y\": 400.0,"
                + "  \"bbox\": [298.0, 396.0, 303.0, 404.0]}],"
                + "\"runway_info\": [{\"designator\": \"4L/22R\", \"length_ft\": 12079, \"width_ft\": 200,"
                + "  \"x\": 0, \"y\": 0, \"surface\": \"\", \"raw_text\": \"4L-22R 12079 X 200\"}],"
                + "\"paths\": [{\"x0\": 1, \"y0\": 2, \"x1\": 3, \"y1\": 4, \"width\": 0.5}],"
                + "\"raw_runway_text\": [\"RWY 4L-22R\"]"
                + "}";

        DiagramSnapshot snapshot = codec.readSnapshot(json);

        assertThat(snapshot.getAirportCode()).isEqualTo("JFK");
        assertThat(snapshot.getTaxiwayLabels()).hasSize(1);
        TaxiwayLabel label = snapshot.getTaxiwayLabels().get(0);
        assertThat(label.getX()).isEqualTo(300.5);
        assertThat(label.getBbox()).isEqualTo(new BoundingBox(298, 396, 303, 404));
        RunwayRecord runway = snapshot.getRunways().get(0);
        assertThat(runway.getLengthFt()).isEqualTo(12079);
        assertThat(runway.getRawText()).isEqualTo("4L-22R 12079 X 200");
        assertThat(snapshot.getPaths().get(0).getWidth()).isEqualTo(0.5);
        assertThat(snapshot.getRawRunwayText()).containsExactly("RWY 4L-22R");
    }

    @Test
    void missingFieldsReadAsDefaults() throws IOException {
        DiagramSnapshot snapshot = codec.readSnapshot(
                "{\"airport_code\": \"LGA\", \"taxiway_labels\": [{\"designator\": \"A\"}],"
                        + " \"runway_info\": null, \"unexpected\": 1}");

        assertThat(snapshot.getCycle()).isEmpty();
        assertThat(snapshot.getPageWidth()).isZero();
        assertThat(snapshot.getRunways()).isEmpty();
        assertThat(snapshot.getPaths()).isEmpty();
        assertThat(snapshot.getTaxiwayLabels().get(0).getX()).isZero();
        assertThat(snapshot.getTaxiwayLabels().get(0).getBbox()).isEqualTo(BoundingBox.EMPTY);
    }

    @Test
    void malformedJsonIsAnIoError() {
        assertThatThrownBy(() -> codec.readSnapshot("{\"airport_code\": "))
                .isInstanceOf(IOException.class);
    }

    @Test
    void writtenSnapshotReadsBackEqual() throws IOException {
        DiagramSnapshot snapshot = DiagramSnapshot.builder()
                .airportCode("EWR")
                .cycle("2601")
                .taxiwayLabels(List.of(TaxiwayLabel.builder().designator("P").x(1).y(2)
                        .bbox(new BoundingBox(0, 0, 2, 4)).build()))
                .build();

        String json = codec.writeSnapshot(snapshot);

        assertThat(json).contains("\"runway_info\"").contains("\"bbox\" : [ 0.0, 0.0, 2.0, 4.0 ]");
        assertThat(codec.readSnapshot(json)).isEqualTo(snapshot);
    }

    @Test
    void writtenResultHasLegacyShape() throws IOException {
        DiagramSnapshot before = DiagramSnapshot.builder().airportCode("JFK").cycle("2601")
                .taxiwayLabels(List.of(TaxiwayLabel.builder().designator("A").x(10).y(20).build())).build();
        DiagramSnapshot after = DiagramSnapshot.builder().airportCode("JFK").cycle("2602").build();
        ComparisonResult result = DiagramComparisonEngine.createDefault().compare(before, after);

        JsonNode json = objectMapper.readTree(codec.writeResult(result));

        assertThat(json.get("airport_code").asText()).isEqualTo("JFK");
        assertThat(json.get("summary").get("taxiways_removed").asInt()).isEqualTo(1);
        JsonNode change = json.get("changes").get(0);
        assertThat(change.get("change_type").asText()).isEqualTo("REMOVED");
        assertThat(change.get("category").asText()).isEqualTo("taxiway");
        assertThat(change.get("old_position").get(2).asDouble()).isEqualTo(20.0);
        assertThat(json.get("taxiway_changes").get(0).get("change_type").asText()).isEqualTo("REMOVED");
        assertThat(json.has("meaningful_changes")).isFalse();
    }
}
