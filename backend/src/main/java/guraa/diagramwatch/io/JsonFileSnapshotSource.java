package guraa.diagramwatch.io;

import guraa.diagramwatch.config.DiagramWatchProperties;
import guraa.diagramwatch.history.SnapshotSource;
import guraa.diagramwatch.model.DiagramSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;

/**
 * Snapshot source backed by a directory of extraction JSON files named
 * {@code <AIRPORT>_<CYCLE>_extracted.json}.
 */
@Slf4j
@Component
public class JsonFileSnapshotSource implements SnapshotSource {

    private static final String FILE_SUFFIX = "_extracted.json";

    private final Path snapshotDirectory;
    private final DiagramJsonCodec codec;

    public JsonFileSnapshotSource(Path snapshotDirectory, DiagramJsonCodec codec) {
        this.snapshotDirectory = snapshotDirectory;
        this.codec = codec;
    }

    @Autowired
    public JsonFileSnapshotSource(DiagramWatchProperties properties, DiagramJsonCodec codec) {
        this(Paths.get(properties.getSnapshotDir()), codec);
    }

    /**
     * Path of the snapshot file for an airport and cycle.
     */
    public Path pathFor(String airportCode, String cycle) {
        return snapshotDirectory.resolve(airportCode.toUpperCase(Locale.ROOT) + "_" + cycle + FILE_SUFFIX);
    }

    /**
     * @throws UncheckedIOException If the file exists but cannot be read as a snapshot
     */
    @Override
    public Optional<DiagramSnapshot> find(String airportCode, String cycle) {
        Path path = pathFor(airportCode, cycle);
        if (!Files.isRegularFile(path)) {
            log.debug("No snapshot at {}", path);
            return Optional.empty();
        }
        try {
            return Optional.of(codec.readSnapshot(path));
        } catch (IOException e) {
            log.error("Error reading snapshot {}: {}", path, e.getMessage());
            throw new UncheckedIOException("Failed to read snapshot " + path, e);
        }
    }
}
