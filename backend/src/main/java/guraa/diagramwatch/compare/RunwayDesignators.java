package guraa.diagramwatch.compare;

import java.util.Locale;

/**
 * Canonical runway designators: "22R-4L", "4L-22R" and "4l/22r" all become "4L/22R".
 */
public final class RunwayDesignators {

    public static final String UNKNOWN = "UNKNOWN";

    private RunwayDesignators() {
    }

    /**
     * Normalize a designator so that the lower heading comes first, separated by "/".
     * Anything that does not split into exactly two ends is only upper-cased.
     *
     * @param designator The designator as extracted
     * @return The canonical form
     */
    public static String normalize(String designator) {
        String value = designator == null ? "" : designator.replace('-', '/');
        String[] ends = value.split("/", -1);
        if (ends.length != 2) {
            return value.toUpperCase(Locale.ROOT);
        }

        String first = ends[0];
        String second = ends[1];
        if (heading(first) > heading(second)) {
            String swap = first;
            first = second;
            second = swap;
        }
        return first.toUpperCase(Locale.ROOT) + "/" + second.toUpperCase(Locale.ROOT);
    }

    /**
     * Whether a normalized designator can be used to match runways across editions.
     */
    public static boolean isComparable(String normalized) {
        return !normalized.isEmpty() && !UNKNOWN.equals(normalized);
    }

    /**
     * The leading digits of a runway end as a number, 0 when there are none.
     */
    static int heading(String end) {
        String trimmed = end.trim();
        int digits = 0;
        while (digits < trimmed.length() && Character.isDigit(trimmed.charAt(digits))) {
            digits++;
        }
        if (digits == 0) {
            return 0;
        }
        try {
            return Integer.parseInt(trimmed.substring(0, digits));
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }
}
