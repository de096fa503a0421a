package io.cronmanager.core;

import java.util.Objects;

/**
 * Folds completed run outcomes into {@link RunStats}.
 */
public final class RunStatsAggregator {
    private RunStatsAggregator() {
    }

    public static RunStats fold(RunStats stats, boolean success, double elapsedSeconds) {
        Objects.requireNonNull(stats, "stats must not be null");
        return new RunStats(
                stats.numberOfRuns() + 1,
                stats.successfulRuns() + (success ? 1 : 0),
                stats.totalExecTime() + elapsedSeconds
        );
    }
}
