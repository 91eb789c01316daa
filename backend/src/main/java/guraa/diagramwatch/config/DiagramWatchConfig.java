package guraa.diagramwatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import guraa.diagramwatch.cycle.AiracCycles;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Configuration for diagram watch beans
 */
@Configuration
@EnableConfigurationProperties(DiagramWatchProperties.class)
public class DiagramWatchConfig {

    /**
     * ObjectMapper shared by the snapshot and result JSON codec.
     * Boot only auto-configures one when spring-web is present, which this build does not carry.
     *
     * @return The configured ObjectMapper
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        return objectMapper;
    }

    @Bean
    public AirportRegistry airportRegistry(DiagramWatchProperties properties) {
        return AirportRegistry.from(properties);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AiracCycles airacCycles(Clock clock, DiagramWatchProperties properties) {
        return new AiracCycles(clock, properties.getAirac().getReferenceDate(),
                properties.getAirac().getReferenceCycle());
    }
}
