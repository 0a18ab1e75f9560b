package com.graphkit.engine;

import com.graphkit.api.ExecutionListener;
import com.graphkit.api.Operation;
import com.graphkit.exception.GraphKitException;
import com.graphkit.exception.InternalConsistencyException;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Executes a plan step by step on the calling thread.
 *
 * Algorithm:
 * 1. Validate: every required input must be present in the supplied values.
 * 2. Seed: the store starts as a copy of the values; nothing counts as an
 * overwrite yet.
 * 3. Iterate: steps run in plan order. Each step's needs are read from the
 * store, the operation is invoked, and its outputs are merged back. Writing a
 * name that is already present appends the old value to its overwrite history.
 * 4. Fail fast: the first failing step aborts the call; no solution is
 * returned.
 *
 * The executor holds no per-call state and may be shared between threads.
 */
public final class SequentialPlanExecutor extends AbstractPlanExecutor {
    private static final Logger log = LogManager.getLogger(SequentialPlanExecutor.class);

    public SequentialPlanExecutor() {
        this(null);
    }

    public SequentialPlanExecutor(ExecutionListener listener) {
        super(listener);
    }

    @Override
    public ExecutionResult execute(Plan plan, Map<String, ?> values) {
        checkInputs(plan, values);
        final long id = nextExecutionId();
        final int n = plan.stepCount();
        ValueStore store = new ValueStore(values);
        int completed = 0;

        fireStart(id, n);
        try {
            for (int j = 0; j < n; j++) {
                Operation op = plan.step(j);
                StepOutcome outcome;
                try {
                    outcome = invokeStep(plan, j, gather(store, op));
                } catch (GraphKitException e) {
                    fireError(id, j, op.name(), e);
                    throw e;
                }
                store.putAll(outcome.outputs());
                completed++;
                if (log.isTraceEnabled())
                    log.trace("Execution {} step {} '{}' done in {} ns", id, j, op.name(), outcome.durationNanos());
                fireCompleted(id, j, op.name(), outcome.durationNanos());
            }
        } finally {
            fireEnd(id, completed);
        }
        return store.toResult();
    }

    private static Map<String, Object> gather(ValueStore store, Operation op) {
        Map<String, Object> inputs = new LinkedHashMap<>(op.needs().size() * 2);
        for (String need : op.needs()) {
            if (!store.contains(need))
                throw new InternalConsistencyException(op.name(), need);
            inputs.put(need, store.get(need));
        }
        return inputs;
    }
}
