package com.graphkit.util;

import com.graphkit.api.ExecutionListener;
import java.util.Arrays;

/**
 * Fans out {@link ExecutionListener} callbacks to several listeners, in
 * registration order.
 */
public class CompositeExecutionListener implements ExecutionListener {
    private volatile ExecutionListener[] listeners = new ExecutionListener[0];

    public CompositeExecutionListener(ExecutionListener... initial) {
        for (ExecutionListener l : initial)
            add(l);
    }

    public synchronized CompositeExecutionListener add(ExecutionListener listener) {
        if (listener == null)
            throw new IllegalArgumentException("listener must not be null");
        ExecutionListener[] old = listeners;
        ExecutionListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onExecutionStart(long executionId, int stepCount) {
        for (ExecutionListener l : listeners)
            l.onExecutionStart(executionId, stepCount);
    }

    @Override
    public void onStepCompleted(long executionId, int stepIndex, String operationName, long durationNanos) {
        for (ExecutionListener l : listeners)
            l.onStepCompleted(executionId, stepIndex, operationName, durationNanos);
    }

    @Override
    public void onStepError(long executionId, int stepIndex, String operationName, Throwable error) {
        for (ExecutionListener l : listeners)
            l.onStepError(executionId, stepIndex, operationName, error);
    }

    @Override
    public void onExecutionEnd(long executionId, int stepsCompleted) {
        for (ExecutionListener l : listeners)
            l.onExecutionEnd(executionId, stepsCompleted);
    }
}
