package com.graphkit.util;

import com.graphkit.api.ExecutionListener;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class StepProfileListenerTest {

    @Test
    public void testAggregatesPerOperation() {
        StepProfileListener profile = new StepProfileListener();
        profile.onExecutionStart(1, 2);
        profile.onStepCompleted(1, 0, "add", 2_000);
        profile.onStepCompleted(1, 1, "double", 1_000);
        profile.onExecutionEnd(1, 2);
        profile.onExecutionStart(2, 1);
        profile.onStepCompleted(2, 0, "add", 4_000);
        profile.onStepError(2, 1, "double", new RuntimeException("x"));
        profile.onExecutionEnd(2, 1);

        StepProfileListener.OperationProfile add = profile.get("add");
        assertEquals("add", add.operation());
        assertEquals(2, add.runs());
        assertEquals(2_000, add.minNanos());
        assertEquals(4_000, add.maxNanos());
        assertEquals(4_000, add.lastNanos());
        assertEquals(3.0, add.meanMicros(), 1e-9);
        assertEquals(1, profile.get("double").errors());
        assertEquals(1, profile.get("double").runs());
        assertEquals(2, profile.executions());

        // largest total first
        assertEquals("add", profile.profiles().get(0).operation());
        String dump = profile.dump();
        assertTrue(dump.indexOf("add") < dump.indexOf("double"));

        profile.reset();
        assertNull(profile.get("add"));
        assertEquals(0, profile.executions());
    }

    @Test
    public void testProfilesAreSnapshots() {
        StepProfileListener profile = new StepProfileListener();
        profile.onStepCompleted(1, 0, "add", 1_000);
        StepProfileListener.OperationProfile before = profile.get("add");
        profile.onStepCompleted(2, 0, "add", 5_000);

        assertEquals(1, before.runs());
        assertEquals(1_000, before.totalNanos());
        assertEquals(2, profile.get("add").runs());
        assertEquals(6_000, profile.get("add").totalNanos());
    }

    @Test
    public void testErrorOnlyOperation() {
        StepProfileListener profile = new StepProfileListener();
        profile.onStepError(1, 0, "fails", new IllegalStateException("x"));

        StepProfileListener.OperationProfile fails = profile.get("fails");
        assertEquals(0, fails.runs());
        assertEquals(1, fails.errors());
        assertEquals(0, fails.minNanos());
        assertEquals(0.0, fails.meanMicros(), 1e-9);
    }

    @Test
    public void testDumpClipsLongNames() {
        StepProfileListener profile = new StepProfileListener();
        String longName = "a_very_long_operation_name_that_overflows_the_column";
        profile.onStepCompleted(1, 0, longName, 1_000);

        String dump = profile.dump();
        assertTrue(dump.contains(longName.substring(0, 30) + " |"));
        assertFalse(dump.contains(longName));
    }

    @Test
    public void testCompositeFansOutInOrder() {
        List<String> seen = new ArrayList<>();
        CompositeExecutionListener composite = new CompositeExecutionListener(recorder("one", seen));
        composite.add(recorder("two", seen));
        assertEquals(2, composite.size());

        composite.onStepCompleted(1, 0, "op", 10);
        assertEquals(List.of("one:op", "two:op"), seen);
    }

    private static ExecutionListener recorder(String id, List<String> seen) {
        return new ExecutionListener() {
            @Override
            public void onExecutionStart(long executionId, int stepCount) {
            }

            @Override
            public void onStepCompleted(long executionId, int stepIndex, String operationName, long durationNanos) {
                seen.add(id + ":" + operationName);
            }

            @Override
            public void onStepError(long executionId, int stepIndex, String operationName, Throwable error) {
            }

            @Override
            public void onExecutionEnd(long executionId, int stepsCompleted) {
            }
        };
    }
}
