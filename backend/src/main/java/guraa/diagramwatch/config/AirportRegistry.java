package guraa.diagramwatch.config;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The airports being watched and the FAA identifier of each one's diagram.
 * Immutable; build one per configuration and pass it to whatever needs it.
 */
public final class AirportRegistry {

    private final Map<String, AirportEntry> airports;
    private final String diagramBaseUrl;

    public AirportRegistry(Map<String, AirportEntry> airports, String diagramBaseUrl) {
        Map<String, AirportEntry> normalized = new LinkedHashMap<>();
        airports.forEach((code, entry) -> normalized.put(code.toUpperCase(Locale.ROOT), entry));
        this.airports = Collections.unmodifiableMap(normalized);
        this.diagramBaseUrl = diagramBaseUrl.endsWith("/")
                ? diagramBaseUrl.substring(0, diagramBaseUrl.length() - 1)
                : diagramBaseUrl;
    }

    /**
     * Build a registry from bound configuration properties.
     */
    public static AirportRegistry from(DiagramWatchProperties properties) {
        Map<String, AirportEntry> entries = new LinkedHashMap<>();
        properties.getAirports().forEach((code, airport) ->
                entries.put(code, new AirportEntry(airport.getFaaNumber(), airport.getName())));
        return new AirportRegistry(entries, properties.getDiagramBaseUrl());
    }

    public boolean contains(String code) {
        return code != null && airports.containsKey(code.toUpperCase(Locale.ROOT));
    }

    /**
     * Codes of all configured airports, in configuration order.
     */
    public Set<String> codes() {
        return airports.keySet();
    }

    public Optional<String> faaNumber(String code) {
        return entry(code).map(AirportEntry::getFaaNumber);
    }

    /**
     * Display name of an airport; the code itself when no name is configured.
     */
    public String displayName(String code) {
        return entry(code)
                .map(AirportEntry::getName)
                .filter(name -> !name.isBlank())
                .orElse(code);
    }

    /**
     * Where the FAA publishes the diagram for an airport and cycle.
     *
     * @throws IllegalArgumentException If the airport is not configured
     */
    public String diagramUrl(String code, String cycle) {
        String faaNumber = faaNumber(code)
                .orElseThrow(() -> new IllegalArgumentException("Unknown airport: " + code));
        return diagramBaseUrl + "/" + cycle + "/" + faaNumber + "AD.PDF";
    }

    private Optional<AirportEntry> entry(String code) {
        return code == null ? Optional.empty() : Optional.ofNullable(airports.get(code.toUpperCase(Locale.ROOT)));
    }

    @Value
    public static class AirportEntry {
        String faaNumber;
        String name;
    }
}
