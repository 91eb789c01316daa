package guraa.diagramwatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the diagram watcher.
 */
@ConfigurationProperties(prefix = "diagram-watch")
public class DiagramWatchProperties {

    private final Map<String, Airport> airports = new LinkedHashMap<>();
    private final Airac airac = new Airac();
    private final History history = new History();
    private String diagramBaseUrl = "https://aeronav.faa.gov/d-tpp";
    private String snapshotDir = "data";

    public Map<String, Airport> getAirports() {
        return airports;
    }

    public Airac getAirac() {
        return airac;
    }

    public History getHistory() {
        return history;
    }

    public String getDiagramBaseUrl() {
        return diagramBaseUrl;
    }

    public void setDiagramBaseUrl(String diagramBaseUrl) {
        this.diagramBaseUrl = diagramBaseUrl;
    }

    public String getSnapshotDir() {
        return snapshotDir;
    }

    public void setSnapshotDir(String snapshotDir) {
        this.snapshotDir = snapshotDir;
    }

    /**
     * A watched airport
     */
    public static class Airport {
        private String faaNumber;
        private String name;

        public String getFaaNumber() {
            return faaNumber;
        }

        public void setFaaNumber(String faaNumber) {
            this.faaNumber = faaNumber;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }

    /**
     * AIRAC cycle reference point
     */
    public static class Airac {
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate referenceDate = LocalDate.of(2025, 12, 26);
        private String referenceCycle = "2601";

        public LocalDate getReferenceDate() {
            return referenceDate;
        }

        public void setReferenceDate(LocalDate referenceDate) {
            this.referenceDate = referenceDate;
        }

        public String getReferenceCycle() {
            return referenceCycle;
        }

        public void setReferenceCycle(String referenceCycle) {
            this.referenceCycle = referenceCycle;
        }
    }

    /**
     * Last-change search settings
     */
    public static class History {
        private int maxCycles = 13;

        public int getMaxCycles() {
            return maxCycles;
        }

        public void setMaxCycles(int maxCycles) {
            this.maxCycles = maxCycles;
        }
    }
}
