package guraa.diagramwatch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.time.Duration;
import java.time.Instant;

/**
 * Main application class for the airport diagram watcher.
 */
@Slf4j
@SpringBootApplication
public class DiagramWatchApplication {

    public static void main(String[] args) {
        Instant startTime = Instant.now();

        System.getProperties().putIfAbsent("java.awt.headless", "true");

        ConfigurableApplicationContext context = SpringApplication.run(DiagramWatchApplication.class, args);
        log.debug("Finished in {} ms", Duration.between(startTime, Instant.now()).toMillis());

        System.exit(SpringApplication.exit(context));
    }
}
