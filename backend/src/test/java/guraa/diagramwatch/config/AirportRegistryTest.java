package guraa.diagramwatch.config;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AirportRegistryTest {

    private final AirportRegistry registry = AirportRegistry.from(properties());

    @Test
    void lookupsAreCaseInsensitive() {
        assertThat(registry.contains("jfk")).isTrue();
        assertThat(registry.contains("ORD")).isFalse();
        assertThat(registry.contains(null)).isFalse();
        assertThat(registry.faaNumber("Lga")).contains("00289");
        assertThat(registry.faaNumber("ORD")).isEmpty();
    }

    @Test
    void codesKeepConfigurationOrder() {
        assertThat(registry.codes()).containsExactly("JFK", "LGA", "TEB");
    }

    @Test
    void displayNameFallsBackToTheCode() {
        assertThat(registry.displayName("JFK")).isEqualTo("John F. Kennedy International");
        assertThat(registry.displayName("TEB")).isEqualTo("TEB");
        assertThat(registry.displayName("ORD")).isEqualTo("ORD");
    }

    @Test
    void diagramUrlCombinesBaseCycleAndFaaNumber() {
        assertThat(registry.diagramUrl("JFK", "2602")).isEqualTo("https://aeronav.faa.gov/d-tpp/2602/00610AD.PDF");
        assertThatThrownBy(() -> registry.diagramUrl("ORD", "2602"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ORD");
    }

    @Test
    void registryIsImmutable() {
        Map<String, AirportRegistry.AirportEntry> entries = new LinkedHashMap<>();
        entries.put("SWF", new AirportRegistry.AirportEntry("00450", "Stewart"));
        AirportRegistry copy = new AirportRegistry(entries, "https://example.test/");
        entries.put("SYR", new AirportRegistry.AirportEntry("00411", "Syracuse"));

        assertThat(copy.codes()).containsExactly("SWF");
        assertThat(copy.diagramUrl("SWF", "2601")).isEqualTo("https://example.test/2601/00450AD.PDF");
        assertThatThrownBy(() -> copy.codes().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    private static DiagramWatchProperties properties() {
        DiagramWatchProperties properties = new DiagramWatchProperties();
        properties.getAirports().put("JFK", airport("00610", "John F. Kennedy International"));
        properties.getAirports().put("lga", airport("00289", "LaGuardia"));
        properties.getAirports().put("TEB", airport("00890", null));
        return properties;
    }

    private static DiagramWatchProperties.Airport airport(String faaNumber, String name) {
        DiagramWatchProperties.Airport airport = new DiagramWatchProperties.Airport();
        airport.setFaaNumber(faaNumber);
        airport.setName(name);
        return airport;
    }
}
