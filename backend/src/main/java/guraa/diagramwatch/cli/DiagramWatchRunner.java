package guraa.diagramwatch.cli;

import guraa.diagramwatch.compare.ComparisonResult;
import guraa.diagramwatch.compare.DiagramComparisonEngine;
import guraa.diagramwatch.config.AirportRegistry;
import guraa.diagramwatch.cycle.AiracCycles;
import guraa.diagramwatch.history.ChangeHistoryService;
import guraa.diagramwatch.history.HistoricalSearchResult;
import guraa.diagramwatch.io.DiagramJsonCodec;
import guraa.diagramwatch.model.DiagramSnapshot;
import guraa.diagramwatch.report.ChangeReportFormatter;
import guraa.diagramwatch.snapshot.DiagramExtractionService;
import guraa.diagramwatch.snapshot.ExtractionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Command line entry point. Results go to stdout, usage and failures to stderr.
 *
 * <pre>
 * extract &lt;pdf&gt; [airport] [cycle]   print the extracted snapshot as JSON
 * compare &lt;old.json&gt; &lt;new.json&gt;     print the comparison as JSON
 * report &lt;old.json&gt; &lt;new.json&gt;      print the plain-text change report
 * history &lt;airport&gt;                 search back for the last diagram change
 * url &lt;airport&gt; [cycle]             print where the diagram is published
 * cycles                            print the current and previous AIRAC cycle
 * </pre>
 */
@Slf4j
@Component
public class DiagramWatchRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    private final DiagramExtractionService extractionService;
    private final DiagramComparisonEngine comparisonEngine;
    private final ChangeHistoryService historyService;
    private final ChangeReportFormatter reportFormatter;
    private final DiagramJsonCodec codec;
    private final AirportRegistry airportRegistry;
    private final AiracCycles airacCycles;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = EXIT_OK;

    @Autowired
    public DiagramWatchRunner(DiagramExtractionService extractionService, DiagramComparisonEngine comparisonEngine,
                              ChangeHistoryService historyService, ChangeReportFormatter reportFormatter,
                              DiagramJsonCodec codec, AirportRegistry airportRegistry, AiracCycles airacCycles) {
        this(extractionService, comparisonEngine, historyService, reportFormatter, codec, airportRegistry,
                airacCycles, System.out, System.err);
    }

    public DiagramWatchRunner(DiagramExtractionService extractionService, DiagramComparisonEngine comparisonEngine,
                              ChangeHistoryService historyService, ChangeReportFormatter reportFormatter,
                              DiagramJsonCodec codec, AirportRegistry airportRegistry, AiracCycles airacCycles,
                              PrintStream out, PrintStream err) {
        this.extractionService = extractionService;
        this.comparisonEngine = comparisonEngine;
        this.historyService = historyService;
        this.reportFormatter = reportFormatter;
        this.codec = codec;
        this.airportRegistry = airportRegistry;
        this.airacCycles = airacCycles;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(String... args) {
        exitCode = execute(Arrays.asList(args));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Run one command.
     *
     * @param args Command name followed by its arguments
     * @return The process exit code
     */
    int execute(List<String> args) {
        if (args.isEmpty()) {
            printUsage();
            return EXIT_USAGE;
        }

        String command = args.get(0).toLowerCase(Locale.ROOT);
        List<String> params = args.subList(1, args.size());
        try {
            switch (command) {
                case "extract":
                    return extract(params);
                case "compare":
                    return compare(params, false);
                case "report":
                    return compare(params, true);
                case "history":
                    return history(params);
                case "url":
                    return url(params);
                case "cycles":
                    out.println("Current AIRAC cycle:  " + airacCycles.current());
                    out.println("Previous AIRAC cycle: " + airacCycles.previous(airacCycles.current()));
                    return EXIT_OK;
                default:
                    err.println("Unknown command: " + command);
                    printUsage();
                    return EXIT_USAGE;
            }
        } catch (IOException e) {
            log.error("Command {} failed: {}", command, e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private int extract(List<String> params) throws IOException {
        if (params.isEmpty() || params.size() > 3) {
            err.println("Usage: extract <pdf> [airport] [cycle]");
            return EXIT_USAGE;
        }

        ExtractionResult result;
        if (params.size() == 1) {
            result = extractionService.extract(Paths.get(params.get(0)));
        } else {
            String cycle = params.size() == 3 ? params.get(2) : DiagramSnapshot.UNKNOWN;
            result = extractionService.extract(Paths.get(params.get(0)),
                    params.get(1).toUpperCase(Locale.ROOT), cycle);
        }

        if (!result.isExtracted()) {
            err.println(result.getStatus() + ": " + result.getMessage());
            return EXIT_FAILURE;
        }
        out.println(codec.writeSnapshot(result.getSnapshot().orElseThrow()));
        return EXIT_OK;
    }

    private int compare(List<String> params, boolean textReport) throws IOException {
        if (params.size() != 2) {
            err.println("Usage: " + (textReport ? "report" : "compare") + " <old.json> <new.json>");
            return EXIT_USAGE;
        }

        DiagramSnapshot oldSnapshot = codec.readSnapshot(Paths.get(params.get(0)));
        DiagramSnapshot newSnapshot = codec.readSnapshot(Paths.get(params.get(1)));
        ComparisonResult result = comparisonEngine.compare(oldSnapshot, newSnapshot);

        out.print(textReport ? reportFormatter.format(result) : codec.writeResult(result) + System.lineSeparator());
        return EXIT_OK;
    }

    private int history(List<String> params) throws IOException {
        if (params.size() != 1) {
            err.println("Usage: history <airport>");
            return EXIT_USAGE;
        }

        HistoricalSearchResult result = historyService.findLastChange(params.get(0));
        out.println(codec.writeHistory(result));
        return result.getError() == null ? EXIT_OK : EXIT_FAILURE;
    }

    private int url(List<String> params) {
        if (params.isEmpty() || params.size() > 2) {
            err.println("Usage: url <airport> [cycle]");
            return EXIT_USAGE;
        }

        String code = params.get(0);
        String cycle = params.size() == 2 ? params.get(1) : airacCycles.current();
        if (!AiracCycles.isValid(cycle)) {
            throw new IllegalArgumentException("Invalid AIRAC cycle: " + cycle);
        }
        out.println(airportRegistry.displayName(code) + ": " + airportRegistry.diagramUrl(code, cycle));
        return EXIT_OK;
    }

    private void printUsage() {
        err.println("Usage: <command> [args]");
        err.println("  extract <pdf> [airport] [cycle]");
        err.println("  compare <old.json> <new.json>");
        err.println("  report <old.json> <new.json>");
        err.println("  history <airport>");
        err.println("  url <airport> [cycle]");
        err.println("  cycles");
    }
}
