package io.cronmanager.core;

import java.util.OptionalDouble;

/**
 * Running totals over all completed runs of a job.
 *
 * numberOfRuns   : completed runs
 * successfulRuns : completed runs reported as successful
 * totalExecTime  : summed elapsed time in seconds
 */
public record RunStats(
        long numberOfRuns,
        long successfulRuns,
        double totalExecTime
) {

    public static RunStats empty() {
        return new RunStats(0, 0, 0d);
    }

    public OptionalDouble successRatio() {
        if (numberOfRuns == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((double) successfulRuns / numberOfRuns);
    }

    public OptionalDouble averageExecTime() {
        if (numberOfRuns == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(totalExecTime / numberOfRuns);
    }
}
