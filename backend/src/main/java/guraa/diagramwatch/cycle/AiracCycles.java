package guraa.diagramwatch.cycle;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * AIRAC cycle arithmetic. A cycle code is {@code YYNN}: two-digit year and cycle number 01 to 13.
 * Cycles are 28 days long and counted from a reference date on which a known cycle began.
 */
public class AiracCycles {

    public static final int CYCLE_DAYS = 28;
    public static final int CYCLES_PER_YEAR = 13;

    private static final Pattern CYCLE_PATTERN = Pattern.compile("^(\\d{2})(\\d{2})$");

    private final Clock clock;
    private final LocalDate referenceDate;
    private final int referenceIndex;

    public AiracCycles(Clock clock, LocalDate referenceDate, String referenceCycle) {
        this.clock = clock;
        this.referenceDate = referenceDate;
        this.referenceIndex = toIndex(referenceCycle);
    }

    /**
     * The cycle in effect today.
     */
    public String current() {
        long daysSinceReference = ChronoUnit.DAYS.between(referenceDate, LocalDate.now(clock));
        long cyclesPassed = Math.floorDiv(daysSinceReference, CYCLE_DAYS);
        return fromIndex(referenceIndex + cyclesPassed);
    }

    /**
     * The cycle before the given one; cycle 01 rolls back to the previous year's 13.
     *
     * @throws IllegalArgumentException If the code is not a valid cycle
     */
    public String previous(String cycle) {
        return fromIndex(toIndex(cycle) - 1L);
    }

    /**
     * The cycle after the given one; cycle 13 rolls over to the next year's 01.
     *
     * @throws IllegalArgumentException If the code is not a valid cycle
     */
    public String next(String cycle) {
        return fromIndex(toIndex(cycle) + 1L);
    }

    /**
     * The current cycle followed by the cycles before it, newest first.
     *
     * @param count Number of cycles to return
     * @return Cycle codes
     */
    public List<String> history(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        List<String> cycles = new ArrayList<>(count);
        long index = toIndex(current());
        for (int i = 0; i < count; i++) {
            cycles.add(fromIndex(index - i));
        }
        return cycles;
    }

    /**
     * Whether the code is a well-formed cycle.
     */
    public static boolean isValid(String cycle) {
        if (cycle == null) {
            return false;
        }
        Matcher matcher = CYCLE_PATTERN.matcher(cycle);
        if (!matcher.matches()) {
            return false;
        }
        int number = Integer.parseInt(matcher.group(2));
        return number >= 1 && number <= CYCLES_PER_YEAR;
    }

    private static int toIndex(String cycle) {
        if (!isValid(cycle)) {
            throw new IllegalArgumentException("Invalid AIRAC cycle: " + cycle);
        }
        int year = Integer.parseInt(cycle.substring(0, 2));
        int number = Integer.parseInt(cycle.substring(2));
        return year * CYCLES_PER_YEAR + number - 1;
    }

    private static String fromIndex(long index) {
        long year = Math.floorMod(Math.floorDiv(index, CYCLES_PER_YEAR), 100);
        long number = Math.floorMod(index, CYCLES_PER_YEAR) + 1;
        return String.format("%02d%02d", year, number);
    }
}
