package guraa.diagramwatch.snapshot;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

class SourceNameTest {

    @Test
    void parsesAirportAndCycle() {
        SourceName name = SourceName.parse(Paths.get("data", "JFK_2602.pdf"));

        assertThat(name.getAirportCode()).isEqualTo("JFK");
        assertThat(name.getCycle()).isEqualTo("2602");
    }

    @Test
    void ignoresTrailingParts() {
        SourceName name = SourceName.parse(Paths.get("JFK_2602_extracted.json"));

        assertThat(name.getCycle()).isEqualTo("2602");
    }

    @Test
    void missingPartsBecomeUnknown() {
        SourceName name = SourceName.parse(Paths.get("diagram.pdf"));

        assertThat(name.getAirportCode()).isEqualTo("diagram");
        assertThat(name.getCycle()).isEqualTo("UNKNOWN");
    }
}
