package guraa.diagramwatch.report;

import guraa.diagramwatch.compare.ComparisonResult;
import guraa.diagramwatch.compare.ComparisonSummary;
import guraa.diagramwatch.compare.GeometryChange;
import guraa.diagramwatch.compare.RunwayChange;
import guraa.diagramwatch.compare.TaxiwayChange;
import org.springframework.stereotype.Component;

/**
 * Renders a comparison result as a plain-text change report.
 */
@Component
public class ChangeReportFormatter {

    static final String RULE = repeat('=', 60);
    static final String SECTION_RULE = repeat('-', 60);
    static final String NO_CHANGES = "  No significant changes detected between cycles.";

    public String format(ComparisonResult result) {
        StringBuilder report = new StringBuilder();
        line(report, "");
        line(report, RULE);
        line(report, "AIRPORT DIAGRAM CHANGE REPORT");
        line(report, RULE);
        line(report, "Airport:        " + result.getAirportCode());
        line(report, "Old Cycle:      " + result.getOldCycle());
        line(report, "New Cycle:      " + result.getNewCycle());
        line(report, RULE);

        appendSummary(report, result.getSummary());

        if (!result.getTaxiwayChanges().isEmpty()) {
            section(report, "Taxiway Changes:");
            for (TaxiwayChange change : result.getTaxiwayChanges()) {
                line(report, String.format("  [%-8s] %s", change.getChangeType(), change.getDescription()));
                line(report, String.format("             Location: (%d, %d)",
                        Math.round(change.getX()), Math.round(change.getY())));
            }
        }

        if (!result.getRunwayChanges().isEmpty()) {
            section(report, "Runway Changes:");
            for (RunwayChange change : result.getRunwayChanges()) {
                line(report, String.format("  [%-15s] %s", change.getChangeType(), change.getDescription()));
            }
        }

        if (!result.getGeometryChanges().isEmpty()) {
            section(report, "Geometry Changes:");
            for (GeometryChange change : result.getGeometryChanges()) {
                line(report, String.format("  [%s] %s", change.getChangeType(), change.getDescription()));
            }
        }

        if (!result.hasChanges()) {
            line(report, "");
            line(report, NO_CHANGES);
        }

        line(report, RULE);
        return report.toString();
    }

    private static void appendSummary(StringBuilder report, ComparisonSummary summary) {
        line(report, "");
        line(report, "Summary:");
        line(report, "  Old diagram: " + summary.getOldUniqueDesignators() + " unique taxiway designators");
        line(report, "  New diagram: " + summary.getNewUniqueDesignators() + " unique taxiway designators");
        line(report, "  Taxiways added:   " + summary.getTaxiwaysAdded());
        line(report, "  Taxiways removed: " + summary.getTaxiwaysRemoved());
        line(report, "  Taxiways renamed: " + summary.getTaxiwaysRenamed());
        line(report, "  Runway changes:   " + summary.getRunwayChanges());
        line(report, "  Geometry changes: " + summary.getGeometryChanges());
    }

    private static void section(StringBuilder report, String title) {
        line(report, "");
        line(report, title);
        line(report, SECTION_RULE);
    }

    private static void line(StringBuilder report, String text) {
        report.append(text).append('\n');
    }

    private static String repeat(char c, int count) {
        return String.valueOf(c).repeat(count);
    }
}
