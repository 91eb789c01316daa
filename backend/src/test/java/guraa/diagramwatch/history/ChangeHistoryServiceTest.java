package guraa.diagramwatch.history;

import guraa.diagramwatch.compare.DiagramComparisonEngine;
import guraa.diagramwatch.config.AirportRegistry;
import guraa.diagramwatch.cycle.AiracCycles;
import guraa.diagramwatch.model.DiagramSnapshot;
import guraa.diagramwatch.model.PathSegment;
import guraa.diagramwatch.model.RunwayRecord;
import guraa.diagramwatch.model.TaxiwayLabel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChangeHistoryServiceTest {

    @Mock private SnapshotSource snapshotSource;

    private final Map<String, DiagramSnapshot> snapshotsByCycle = new HashMap<>();

    private ChangeHistoryService service;

    @BeforeEach
    void setUp() {
        AirportRegistry registry = new AirportRegistry(
                Map.of("JFK", new AirportRegistry.AirportEntry("00610", "John F. Kennedy International")),
                "https://aeronav.faa.gov/d-tpp");
        // current cycle is 2602
        Clock clock = Clock.fixed(LocalDate.of(2026, 1, 23).atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        AiracCycles cycles = new AiracCycles(clock, LocalDate.of(2025, 12, 26), "2601");
        service = new ChangeHistoryService(snapshotSource, DiagramComparisonEngine.createDefault(),
                registry, cycles, 4);
    }

    @Test
    void unknownAirportIsAnErrorResult() {
        HistoricalSearchResult result = service.findLastChange("xyz");

        assertThat(result.isFound()).isFalse();
        assertThat(result.getError()).isEqualTo("Unknown airport: XYZ");
        verifyNoInteractions(snapshotSource);
    }

    @Test
    void missingCurrentSnapshotIsAnErrorResult() {
        stubSnapshots();

        HistoricalSearchResult result = service.findLastChange("JFK");

        assertThat(result.isFound()).isFalse();
        assertThat(result.getError()).isEqualTo("Could not extract current diagram");
    }

    @Test
    void findsTheNewestOlderCycleThatDiffers() {
        snapshotsByCycle.put("2602", snapshot("2602", List.of("A", "B", "C"), 7499));
        snapshotsByCycle.put("2601", snapshot("2601", List.of("A", "B", "C"), 7499));
        snapshotsByCycle.put("2513", snapshot("2513", List.of("A", "D"), 7200));
        stubSnapshots();

        HistoricalSearchResult result = service.findLastChange("jfk");

        assertThat(result.isFound()).isTrue();
        assertThat(result.getCurrentCycle()).isEqualTo("2602");
        assertThat(result.getLastChangeCycle()).isEqualTo("2513");
        assertThat(result.getCyclesSearched()).isEqualTo(2);
        assertThat(result.getTaxiwaysAdded()).containsExactly("B", "C");
        assertThat(result.getTaxiwaysRemoved()).containsExactly("D");
        assertThat(result.getRunwayChanges()).containsExactly("Runway 10/28 extended by 299 ft (7200 → 7499 ft)");
        assertThat(result.getComparison().getOldCycle()).isEqualTo("2513");
        assertThat(result.getComparison().getNewCycle()).isEqualTo("2602");
        verify(snapshotSource, never()).find("JFK", "2512");
    }

    @Test
    void searchStopsAtTheFirstUnavailableCycle() {
        snapshotsByCycle.put("2602", snapshot("2602", List.of("A"), 7200));
        snapshotsByCycle.put("2601", snapshot("2601", List.of("A"), 7200));
        snapshotsByCycle.put("2512", snapshot("2512", List.of("Z"), 7200));
        stubSnapshots();

        HistoricalSearchResult result = service.findLastChange("JFK");

        assertThat(result.isFound()).isFalse();
        assertThat(result.getCyclesSearched()).isEqualTo(2);
        assertThat(result.getLastChangeCycle()).isNull();
        assertThat(result.getMessage()).isEqualTo("No changes found in last 2 cycles (~56 days)");
        verify(snapshotSource, never()).find("JFK", "2512");
    }

    @Test
    void searchIsBoundedByMaxCycles() {
        for (String cycle : List.of("2602", "2601", "2513", "2512", "2511", "2510")) {
            snapshotsByCycle.put(cycle, snapshot(cycle, List.of("A"), 7200));
        }
        stubSnapshots();

        HistoricalSearchResult result = service.findLastChange("JFK");

        assertThat(result.isFound()).isFalse();
        assertThat(result.getCyclesSearched()).isEqualTo(4);
        assertThat(result.getMessage()).isEqualTo("No changes found in last 4 cycles (~112 days)");
        verify(snapshotSource, never()).find("JFK", "2510");
    }

    @Test
    void geometryOnlyDifferenceIsNotAChange() {
        DiagramSnapshot current = snapshot("2602", List.of("A"), 7200);
        snapshotsByCycle.put("2602", current);
        snapshotsByCycle.put("2601", DiagramSnapshot.builder()
                .airportCode("JFK").cycle("2601")
                .taxiwayLabels(current.getTaxiwayLabels())
                .runways(current.getRunways())
                .paths(segments(200))
                .build());
        stubSnapshots();

        HistoricalSearchResult result = service.findLastChange("JFK");

        assertThat(result.isFound()).isFalse();
        assertThat(result.getCyclesSearched()).isEqualTo(2);
    }

    private void stubSnapshots() {
        when(snapshotSource.find(eq("JFK"), anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(snapshotsByCycle.get(invocation.getArgument(1))));
    }

    private static DiagramSnapshot snapshot(String cycle, List<String> designators, int runwayLength) {
        List<TaxiwayLabel> labels = new ArrayList<>();
        for (int i = 0; i < designators.size(); i++) {
            labels.add(TaxiwayLabel.builder().designator(designators.get(i)).x(100 + i * 50).y(200).build());
        }
        return DiagramSnapshot.builder()
                .airportCode("JFK")
                .cycle(cycle)
                .taxiwayLabels(labels)
                .runways(List.of(RunwayRecord.builder().designator("10/28").lengthFt(runwayLength).widthFt(150).build()))
                .build();
    }

    private static List<PathSegment> segments(int count) {
        List<PathSegment> segments = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            segments.add(new PathSegment(i, 0, i, 10, 1));
        }
        return segments;
    }
}
