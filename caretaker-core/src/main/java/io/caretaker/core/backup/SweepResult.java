package io.caretaker.core.backup;

/**
 * Outcome of one retention sweep.
 *
 * @param enabled false when retention was disabled ({@code retentionDays <= 0}) and nothing was examined
 */
public record SweepResult(int deletedCount, long freedBytes, int failedCount, boolean enabled) {

    public static SweepResult disabled() {
        return new SweepResult(0, 0L, 0, false);
    }

    public static SweepResult empty() {
        return new SweepResult(0, 0L, 0, true);
    }
}
