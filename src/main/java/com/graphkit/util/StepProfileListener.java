package com.graphkit.util;

import com.graphkit.api.ExecutionListener;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates timing statistics per operation to identify bottlenecks.
 *
 * Statistics are keyed by operation name, so the same operation is tracked
 * across different plans. All methods are synchronized; one instance may be
 * shared by concurrent executions. Readers receive {@link OperationProfile}
 * snapshots that do not change as further steps are recorded.
 */
public class StepProfileListener implements ExecutionListener {

    /**
     * Timing of one operation across every execution seen so far. Durations
     * are in nanoseconds; min and max are zero until the operation completes
     * once.
     */
    public record OperationProfile(String operation, long runs, long errors, long totalNanos, long minNanos,
            long maxNanos, long lastNanos) {

        public double meanMicros() {
            return runs == 0 ? 0.0 : totalNanos / 1000.0 / runs;
        }
    }

    private final Map<String, Tally> tallies = new LinkedHashMap<>();
    private long executions;

    /** @return Profile of one operation, or null if it never ran. */
    public synchronized OperationProfile get(String operationName) {
        Tally t = tallies.get(operationName);
        return t == null ? null : t.snapshot(operationName);
    }

    /** @return Every recorded operation, largest total time first. */
    public synchronized List<OperationProfile> profiles() {
        List<OperationProfile> out = new ArrayList<>(tallies.size());
        tallies.forEach((name, t) -> out.add(t.snapshot(name)));
        out.sort(Comparator.comparingLong(OperationProfile::totalNanos).reversed());
        return out;
    }

    public synchronized long executions() {
        return executions;
    }

    @Override
    public void onExecutionStart(long executionId, int stepCount) {
        // No-op
    }

    @Override
    public synchronized void onStepCompleted(long executionId, int stepIndex, String operationName,
            long durationNanos) {
        tallies.computeIfAbsent(operationName, k -> new Tally()).run(durationNanos);
    }

    @Override
    public synchronized void onStepError(long executionId, int stepIndex, String operationName, Throwable error) {
        tallies.computeIfAbsent(operationName, k -> new Tally()).errors++;
    }

    @Override
    public synchronized void onExecutionEnd(long executionId, int stepsCompleted) {
        executions++;
    }

    /** Resets all collected statistics. */
    public synchronized void reset() {
        tallies.clear();
        executions = 0;
    }

    /** Returns a formatted table of operation statistics, largest total first. */
    public String dump() {
        List<OperationProfile> rows = profiles();
        StringBuilder sb = new StringBuilder(128 + rows.size() * 96);
        sb.append(String.format("%-30s | %8s | %6s | %10s | %10s | %10s | %10s%n", "Operation", "Runs", "Errors",
                "Last (us)", "Mean (us)", "Min (us)", "Max (us)"));
        sb.append("-".repeat(104)).append('\n');
        for (OperationProfile p : rows)
            sb.append(String.format("%-30.30s | %8d | %6d | %10.2f | %10.2f | %10.2f | %10.2f%n",
                    p.operation(), p.runs(), p.errors(), p.lastNanos() / 1000.0, p.meanMicros(),
                    p.minNanos() / 1000.0, p.maxNanos() / 1000.0));
        return sb.toString();
    }

    private static final class Tally {
        long runs;
        long errors;
        long totalNanos;
        long minNanos;
        long maxNanos;
        long lastNanos;

        void run(long nanos) {
            minNanos = runs == 0 ? nanos : Math.min(minNanos, nanos);
            maxNanos = Math.max(maxNanos, nanos);
            runs++;
            totalNanos += nanos;
            lastNanos = nanos;
        }

        OperationProfile snapshot(String name) {
            return new OperationProfile(name, runs, errors, totalNanos, minNanos, maxNanos, lastNanos);
        }
    }
}
