package org.janelia.noise.util;

import java.util.Locale;

/**
 * Counts completed units of a batch (images, variants, comparisons) and tells
 * callers when it is time for another progress log line.
 */
public class BatchProgress {

    public static final long DEFAULT_LOG_INTERVAL = 5000;

    private final String unitName;
    private final int totalUnits;
    private final long logInterval;
    private final long startMillis;
    private long lastLogMillis;
    private int completedUnits;

    public BatchProgress(final String unitName,
                         final int totalUnits) {
        this(unitName, totalUnits, DEFAULT_LOG_INTERVAL);
    }

    /**
     * @param  unitName     plural name of the counted units (used in {@link #toString()}).
     * @param  totalUnits   expected number of units.
     * @param  logInterval  minimum number of milliseconds between progress lines.
     */
    public BatchProgress(final String unitName,
                         final int totalUnits,
                         final long logInterval) {
        this.unitName = unitName;
        this.totalUnits = totalUnits;
        this.logInterval = logInterval;
        this.startMillis = System.currentTimeMillis();
        this.lastLogMillis = this.startMillis;
        this.completedUnits = 0;
    }

    /**
     * Counts one more completed unit.
     *
     * @return true if a progress line is due (at most once per log interval).
     */
    public synchronized boolean completeUnit() {
        completedUnits++;
        final long now = System.currentTimeMillis();
        final boolean isLogDue = (now - lastLogMillis) > logInterval;
        if (isLogDue) {
            lastLogMillis = now;
        }
        return isLogDue;
    }

    public synchronized int getCompletedUnits() {
        return completedUnits;
    }

    public int getTotalUnits() {
        return totalUnits;
    }

    public long getElapsedMillis() {
        return System.currentTimeMillis() - startMillis;
    }

    /**
     * @return elapsed time formatted as hours:minutes:seconds.
     */
    public String getElapsedTime() {
        return formatDuration(getElapsedMillis());
    }

    @Override
    public synchronized String toString() {
        return completedUnits + " of " + totalUnits + " " + unitName + " after " + getElapsedTime();
    }

    public static String formatDuration(final long millis) {
        final long totalSeconds = Math.max(0, millis) / 1000;
        return String.format(Locale.US, "%d:%02d:%02d",
                             totalSeconds / 3600, (totalSeconds / 60) % 60, totalSeconds % 60);
    }

}
