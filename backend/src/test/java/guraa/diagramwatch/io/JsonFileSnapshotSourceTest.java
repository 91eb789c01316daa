package guraa.diagramwatch.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import guraa.diagramwatch.model.DiagramSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileSnapshotSourceTest {

    @TempDir
    Path snapshotDir;

    private final DiagramJsonCodec codec = new DiagramJsonCodec(new ObjectMapper());

    @Test
    void findsSnapshotByAirportAndCycle() throws IOException {
        JsonFileSnapshotSource source = new JsonFileSnapshotSource(snapshotDir, codec);
        DiagramSnapshot snapshot = DiagramSnapshot.builder().airportCode("JFK").cycle("2602").build();
        Files.write(snapshotDir.resolve("JFK_2602_extracted.json"),
                codec.writeSnapshot(snapshot).getBytes(StandardCharsets.UTF_8));

        Optional<DiagramSnapshot> found = source.find("jfk", "2602");

        assertThat(found).contains(snapshot);
        assertThat(source.pathFor("jfk", "2602")).isEqualTo(snapshotDir.resolve("JFK_2602_extracted.json"));
    }

    @Test
    void missingFileIsUnavailable() {
        JsonFileSnapshotSource source = new JsonFileSnapshotSource(snapshotDir, codec);

        assertThat(source.find("JFK", "2601")).isEmpty();
    }

    @Test
    void unreadableFileIsAnError() throws IOException {
        JsonFileSnapshotSource source = new JsonFileSnapshotSource(snapshotDir, codec);
        Files.write(snapshotDir.resolve("JFK_2601_extracted.json"), "{ broken".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> source.find("JFK", "2601"))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("JFK_2601_extracted.json");
    }
}
