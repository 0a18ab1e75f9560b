package com.graphkit.engine;

import com.graphkit.api.ExecutionListener;
import com.graphkit.exception.GraphKitException;
import com.graphkit.exception.InternalConsistencyException;
import com.graphkit.exception.OperationExecutionException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.extern.log4j.Log4j2;

/**
 * Executes independent plan steps concurrently on a bounded worker pool.
 *
 * Scheduling:
 * A step is submitted as soon as every step it depends on has completed. Its
 * inputs are resolved from the caller's values and the outputs of its
 * dependencies: for each need, the output of the latest earlier step providing
 * it, otherwise the input value. This is exactly what the sequential executor
 * would read from its store at that point.
 *
 * Merging:
 * The calling thread is the single coordinator. It drains completions and
 * commits outputs into the store strictly in plan order, so the solution and
 * the overwrite histories are identical to a sequential run regardless of
 * which worker finished first. Listener callbacks are issued on this thread.
 *
 * Failure:
 * Once a step fails no new steps are scheduled. Steps already running are
 * allowed to finish, then the first failure observed is thrown.
 */
@Log4j2
public final class ParallelPlanExecutor extends AbstractPlanExecutor {
    private final ExecutorService pool;
    private final boolean ownsPool;

    /** Uses a caller-owned pool; {@link #close()} leaves it running. */
    public ParallelPlanExecutor(ExecutorService pool, ExecutionListener listener) {
        super(listener);
        if (pool == null)
            throw new IllegalArgumentException("pool must not be null");
        this.pool = pool;
        this.ownsPool = false;
    }

    /** Creates an owned fixed pool of daemon threads sized by the settings. */
    public ParallelPlanExecutor(ExecutionSettings settings) {
        super(settings.getListener());
        if (settings.getParallelism() < 1)
            throw new IllegalArgumentException("parallelism must be >= 1, got " + settings.getParallelism());
        AtomicInteger threadIds = new AtomicInteger();
        String prefix = settings.getThreadNamePrefix();
        this.pool = Executors.newFixedThreadPool(settings.getParallelism(), r -> {
            Thread t = new Thread(r, prefix + "-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.ownsPool = true;
    }

    @Override
    public ExecutionResult execute(Plan plan, Map<String, ?> values) {
        checkInputs(plan, values);
        final long id = nextExecutionId();
        final int n = plan.stepCount();
        final Map<String, Object> seed = new LinkedHashMap<>(values);
        final StepOutcome[] results = new StepOutcome[n];
        final int[] pendingDeps = new int[n];

        ValueStore store = new ValueStore(values);
        CompletionService<Completion> completions = new ExecutorCompletionService<>(pool);
        int inFlight = 0, nextCommit = 0;
        GraphKitException failure = null;

        fireStart(id, n);
        try {
            for (int j = 0; j < n; j++) {
                pendingDeps[j] = plan.dependencyCount(j);
                if (pendingDeps[j] == 0) {
                    submit(completions, plan, j, seed, results);
                    inFlight++;
                }
            }

            while (inFlight > 0) {
                Completion done;
                try {
                    done = await(completions);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    int pending = Math.min(nextCommit, n - 1);
                    throw new OperationExecutionException(plan.step(pending).name(), e,
                            Map.of("operation", plan.step(pending).name(), "step", pending));
                }
                inFlight--;

                if (done.error() != null) {
                    if (failure == null) {
                        failure = done.error();
                        fireError(id, done.step(), plan.step(done.step()).name(), failure);
                    }
                    continue;
                }
                results[done.step()] = done.outcome();
                if (failure != null)
                    continue;

                // Commit the completed prefix in plan order.
                while (nextCommit < n && results[nextCommit] != null) {
                    StepOutcome outcome = results[nextCommit];
                    store.putAll(outcome.outputs());
                    fireCompleted(id, nextCommit, plan.step(nextCommit).name(), outcome.durationNanos());
                    nextCommit++;
                }

                for (int i = 0; i < plan.dependentCount(done.step()); i++) {
                    int dependent = plan.dependent(done.step(), i);
                    if (--pendingDeps[dependent] == 0) {
                        submit(completions, plan, dependent, seed, results);
                        inFlight++;
                    }
                }
            }
        } finally {
            fireEnd(id, nextCommit);
        }

        if (failure != null)
            throw failure;
        if (nextCommit != n)
            throw new InternalConsistencyException(plan.step(nextCommit).name(), "<unscheduled>");
        return store.toResult();
    }

    private static void submit(CompletionService<Completion> completions, Plan plan, int j,
            Map<String, Object> seed, StepOutcome[] results) {
        completions.submit(() -> {
            try {
                return new Completion(j, invokeStep(plan, j, resolve(plan, j, seed, results)), null);
            } catch (GraphKitException e) {
                return new Completion(j, null, e);
            }
        });
    }

    private static Map<String, Object> resolve(Plan plan, int j, Map<String, Object> seed, StepOutcome[] results) {
        Network net = plan.network();
        int oi = plan.stepOperationIndex(j);
        Map<String, Object> inputs = new LinkedHashMap<>(net.needCount(oi) * 2);
        for (int k = 0; k < net.needCount(oi); k++) {
            String need = net.dataName(net.need(oi, k));
            int source = plan.needSource(j, k);
            if (source >= 0) {
                inputs.put(need, results[source].outputs().get(need));
            } else if (seed.containsKey(need)) {
                inputs.put(need, seed.get(need));
            } else {
                throw new InternalConsistencyException(net.operationName(oi), need);
            }
        }
        return inputs;
    }

    private static Completion await(CompletionService<Completion> completions) throws InterruptedException {
        Future<Completion> f = completions.take();
        try {
            return f.get();
        } catch (ExecutionException e) {
            // Tasks catch engine failures themselves; only Errors and unexpected
            // runtime exceptions reach here.
            Throwable cause = e.getCause();
            if (cause instanceof Error err)
                throw err;
            if (cause instanceof RuntimeException re)
                throw re;
            throw new IllegalStateException("Unexpected worker failure", cause);
        }
    }

    @Override
    public void close() {
        if (ownsPool) {
            pool.shutdown();
            log.debug("Worker pool shut down");
        }
    }

    private record Completion(int step, StepOutcome outcome, GraphKitException error) {
    }
}
