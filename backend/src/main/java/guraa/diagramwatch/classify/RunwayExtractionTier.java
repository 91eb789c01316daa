package guraa.diagramwatch.classify;

import guraa.diagramwatch.model.RunwayRecord;

import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strategies for reading runway records out of page text, in decreasing order of confidence.
 * The classifier tries them in declaration order and keeps the first non-empty result.
 */
public enum RunwayExtractionTier {

    /**
     * Designator and dimensions on the same line, e.g. "4L-22R 14572 X 150".
     */
    COMBINED_PATTERN {
        @Override
        List<RunwayRecord> extract(RunwayTextContext context) {
            List<RunwayRecord> runways = new ArrayList<>();
            Matcher matcher = COMBINED_PATTERN_REGEX.matcher(context.getFullText());
            while (matcher.find()) {
                int length = Integer.parseInt(matcher.group(3));
                int width = Integer.parseInt(matcher.group(4));
                runways.add(record(matcher.group(1) + "/" + matcher.group(2), length, width,
                        context.positionOf(length, width), matcher.group()));
            }
            return runways;
        }
    },

    /**
     * Designators listed after "RWY"/"RWYS" paired by order with the runway-sized dimensions.
     * Dimensions left over after the last designator are kept as unknown runways.
     */
    POSITIONAL_MATCH {
        @Override
        List<RunwayRecord> extract(RunwayTextContext context) {
            List<String> designators = new ArrayList<>();
            Matcher listMatcher = RUNWAY_LIST_REGEX.matcher(context.getFullText());
            while (listMatcher.find()) {
                Matcher pairMatcher = RUNWAY_PAIR_REGEX.matcher(listMatcher.group(1));
                while (pairMatcher.find()) {
                    String designator = pairMatcher.group(1) + "/" + pairMatcher.group(2);
                    if (!designators.contains(designator)) {
                        designators.add(designator);
                    }
                }
            }

            List<int[]> dimensions = runwayDimensions(context);
            List<RunwayRecord> runways = new ArrayList<>();
            for (int i = 0; i < dimensions.size(); i++) {
                int length = dimensions.get(i)[0];
                int width = dimensions.get(i)[1];
                String designator = i < designators.size() ? designators.get(i) : RunwayRecord.UNKNOWN_DESIGNATOR;
                runways.add(record(designator, length, width, context.positionOf(length, width),
                        designator + ": " + length + " x " + width));
            }
            return runways;
        }
    },

    /**
     * Every runway-sized dimension becomes an unknown runway.
     */
    DIMENSION_ONLY {
        @Override
        List<RunwayRecord> extract(RunwayTextContext context) {
            List<RunwayRecord> runways = new ArrayList<>();
            Matcher matcher = RunwayTextContext.DIMENSION_PATTERN.matcher(context.getFullText());
            while (matcher.find()) {
                int length = Integer.parseInt(matcher.group(1));
                int width = Integer.parseInt(matcher.group(2));
                if (length >= RunwayTextContext.MIN_RUNWAY_LENGTH_FT) {
                    runways.add(record(RunwayRecord.UNKNOWN_DESIGNATOR, length, width,
                            context.positionOf(length, width), matcher.group()));
                }
            }
            return runways;
        }
    },

    /**
     * No tier matched; the page yields no runway records.
     */
    NONE {
        @Override
        List<RunwayRecord> extract(RunwayTextContext context) {
            return List.of();
        }
    };

    private static final Pattern COMBINED_PATTERN_REGEX = Pattern.compile(
            "(\\d{1,2}[LCR]?)\\s*[-/]\\s*(\\d{1,2}[LCR]?)\\s+(\\d{4,5})\\s*[Xx]\\s*(\\d{2,3})");

    private static final Pattern RUNWAY_LIST_REGEX = Pattern.compile(
            "RWYS?\\s+(\\d{1,2}[LCR]?[-/]\\d{1,2}[LCR]?(?:\\s*,\\s*\\d{1,2}[LCR]?[-/]\\d{1,2}[LCR]?)*)");

    private static final Pattern RUNWAY_PAIR_REGEX = Pattern.compile("(\\d{1,2}[LCR]?)[-/](\\d{1,2}[LCR]?)");

    abstract List<RunwayRecord> extract(RunwayTextContext context);

    private static List<int[]> runwayDimensions(RunwayTextContext context) {
        List<int[]> dimensions = new ArrayList<>();
        Matcher matcher = RunwayTextContext.DIMENSION_PATTERN.matcher(context.getFullText());
        while (matcher.find()) {
            int length = Integer.parseInt(matcher.group(1));
            if (length >= RunwayTextContext.MIN_RUNWAY_LENGTH_FT) {
                dimensions.add(new int[]{length, Integer.parseInt(matcher.group(2))});
            }
        }
        return dimensions;
    }

    private static RunwayRecord record(String designator, int length, int width, Point2D position, String rawText) {
        return RunwayRecord.builder()
                .designator(designator)
                .lengthFt(length)
                .widthFt(width)
                .x(position.getX())
                .y(position.getY())
                .rawText(rawText)
                .build();
    }
}
