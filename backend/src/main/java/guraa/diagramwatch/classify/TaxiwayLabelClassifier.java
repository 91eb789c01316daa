package guraa.diagramwatch.classify;

import guraa.diagramwatch.model.TaxiwayLabel;
import guraa.diagramwatch.scan.TextPrimitive;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Picks taxiway designator labels out of the page text.
 */
@Slf4j
@Component
public class TaxiwayLabelClassifier {

    static final float MIN_FONT_SIZE = 4.0f;
    static final float MAX_FONT_SIZE = 10.0f;

    /**
     * One to three letters; I and O are never used as taxiway letters, in any position.
     */
    private static final Pattern DESIGNATOR_PATTERN = Pattern.compile("^[A-HJ-NP-Z]{1,3}$");

    /**
     * Abbreviations, month codes and airport codes that happen to look like designators.
     */
    private static final Set<String> EXCLUDED_TOKENS = Set.of(
            "TWY", "RWY", "TWR", "GND", "DEL", "APP", "DEP",
            "NOT", "FOR", "USE", "THE", "AND", "FEB", "JAN",
            "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP",
            "OCT", "NOV", "DEC", "FAA", "USA", "NYC", "LAX");

    /**
     * Check whether a piece of text is shaped like a taxiway designator.
     *
     * @param text The raw span text
     * @return true for designators such as "A", "YA" or "KD"
     */
    public boolean isTaxiwayDesignator(String text) {
        if (text == null) {
            return false;
        }
        String candidate = text.trim().toUpperCase(Locale.ROOT);
        return !EXCLUDED_TOKENS.contains(candidate) && DESIGNATOR_PATTERN.matcher(candidate).matches();
    }

    /**
     * Classify the taxiway labels among the page's text spans.
     * Spans whose rounded center repeats an already accepted label are dropped.
     *
     * @param spans All text spans of the page
     * @param bounds The diagram interior
     * @return Accepted labels in span order
     */
    public List<TaxiwayLabel> classify(List<TextPrimitive> spans, DiagramBounds bounds) {
        List<TaxiwayLabel> labels = new ArrayList<>();
        Set<String> seenPositions = new HashSet<>();

        for (TextPrimitive span : spans) {
            double centerX = span.getCenterX();
            double centerY = span.getCenterY();

            if (!bounds.contains(centerX, centerY)) {
                continue;
            }
            if (span.getFontSize() < MIN_FONT_SIZE || span.getFontSize() > MAX_FONT_SIZE) {
                continue;
            }
            if (!isTaxiwayDesignator(span.getText())) {
                continue;
            }

            // The renderer sometimes emits the same label twice (outline and fill)
            String positionKey = Math.round(centerX) + ":" + Math.round(centerY);
            if (!seenPositions.add(positionKey)) {
                continue;
            }

            labels.add(TaxiwayLabel.builder()
                    .designator(span.getText().trim().toUpperCase(Locale.ROOT))
                    .x(centerX)
                    .y(centerY)
                    .bbox(span.getBbox())
                    .build());
        }

        log.debug("Classified {} taxiway labels from {} text spans", labels.size(), spans.size());
        return labels;
    }
}
