package com.graphkit.engine;

import com.graphkit.api.ExecutionListener;
import com.graphkit.api.Operation;
import com.graphkit.exception.MissingInputException;
import com.graphkit.exception.OperationExecutionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Shared step invocation for the executors: input validation, contract
 * checking of operation results and error wrapping.
 */
abstract class AbstractPlanExecutor implements PlanExecutor {
    private static final Logger log = LogManager.getLogger(AbstractPlanExecutor.class);
    private static final AtomicLong EXECUTION_IDS = new AtomicLong();

    protected final ExecutionListener listener;

    protected AbstractPlanExecutor(ExecutionListener listener) {
        this.listener = listener;
    }

    protected static long nextExecutionId() {
        return EXECUTION_IDS.incrementAndGet();
    }

    protected static void checkInputs(Plan plan, Map<String, ?> values) {
        if (values == null)
            throw new IllegalArgumentException("values must not be null");
        List<String> missing = new ArrayList<>();
        for (String in : plan.requiredInputs())
            if (!values.containsKey(in))
                missing.add(in);
        if (!missing.isEmpty())
            throw new MissingInputException(missing);
    }

    /**
     * Invokes step j with the given inputs and validates its outputs.
     *
     * @return The declared outputs in provides order, with the time spent in the
     *         operation body.
     * @throws OperationExecutionException if the body throws or returns a value
     *                                     set not covering its provides.
     */
    protected static StepOutcome invokeStep(Plan plan, int j, Map<String, Object> inputs) {
        Operation op = plan.step(j);
        long start = System.nanoTime();
        Map<String, Object> produced;
        try {
            produced = op.invoke(Collections.unmodifiableMap(inputs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure(j, op, e, inputs);
        } catch (Exception e) {
            throw failure(j, op, e, inputs);
        }
        long duration = System.nanoTime() - start;

        if (produced == null)
            throw failure(j, op, new IllegalStateException("Operation returned no outputs"), inputs);

        Map<String, Object> outputs = new LinkedHashMap<>(op.provides().size() * 2);
        List<String> missing = new ArrayList<>();
        for (String name : op.provides()) {
            if (produced.containsKey(name))
                outputs.put(name, produced.get(name));
            else
                missing.add(name);
        }
        if (!missing.isEmpty())
            throw failure(j, op, new IllegalStateException("Operation did not provide " + missing), inputs);
        if (produced.size() > outputs.size() && log.isDebugEnabled())
            log.debug("Operation '{}' returned undeclared outputs, ignored: {}", op.name(), produced.keySet());
        return new StepOutcome(outputs, duration);
    }

    protected void fireStart(long id, int steps) {
        if (listener != null)
            listener.onExecutionStart(id, steps);
    }

    protected void fireCompleted(long id, int j, String name, long durationNanos) {
        if (listener != null)
            listener.onStepCompleted(id, j, name, durationNanos);
    }

    protected void fireError(long id, int j, String name, Throwable error) {
        log.error("Execution {} failed at step {} '{}': {}", id, j, name, error.getMessage());
        if (listener != null)
            listener.onStepError(id, j, name, error.getCause() != null ? error.getCause() : error);
    }

    protected void fireEnd(long id, int completed) {
        if (listener != null)
            listener.onExecutionEnd(id, completed);
    }

    private static OperationExecutionException failure(int j, Operation op, Throwable cause,
            Map<String, Object> inputs) {
        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("operation", op.name());
        diagnostics.put("step", j);
        diagnostics.put("needs", op.needs());
        diagnostics.put("provides", op.provides());
        diagnostics.put("inputs", Collections.unmodifiableMap(new LinkedHashMap<>(inputs)));
        return new OperationExecutionException(op.name(), cause, diagnostics);
    }

    /** Validated outputs of one step. */
    protected record StepOutcome(Map<String, Object> outputs, long durationNanos) {
    }
}
