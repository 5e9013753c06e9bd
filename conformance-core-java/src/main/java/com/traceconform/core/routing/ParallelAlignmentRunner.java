package com.traceconform.core.routing;

import com.traceconform.core.ConformanceException;
import com.traceconform.core.engine.AlignmentResult;
import com.traceconform.core.log.EventLog;
import com.traceconform.core.log.Logs;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Aligns each trace of a log on its own worker and reassembles the results in input order.
 *
 * The model and properties captured by {@code alignSingle} are shared read-only between workers.
 * The first failing trace (in input order) aborts the batch; no partial list is returned.
 */
public class ParallelAlignmentRunner {

    private final int workers;

    public ParallelAlignmentRunner(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got " + workers);
        }
        this.workers = workers;
    }

    public List<AlignmentResult> run(EventLog log, Function<EventLog, List<AlignmentResult>> alignSingle) {
        if (log.size() == 0) {
            return List.of();
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(workers, log.size()), new WorkerFactory());
        try {
            List<Future<AlignmentResult>> futures = new ArrayList<>(log.size());
            for (int i = 0; i < log.size(); i++) {
                EventLog single = Logs.singleton(log.get(i));
                final int index = i;
                futures.add(pool.submit(() -> onlyResult(alignSingle.apply(single), index)));
            }
            List<AlignmentResult> results = new ArrayList<>(futures.size());
            for (Future<AlignmentResult> f : futures) {
                results.add(f.get());
            }
            return results;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new ConformanceException("Alignment worker failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConformanceException("Interrupted while waiting for alignment workers", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private static AlignmentResult onlyResult(List<AlignmentResult> results, int traceIndex) {
        if (results == null || results.size() != 1) {
            throw new ConformanceException("Alignment engine returned "
                    + (results == null ? "null" : results.size() + " results")
                    + " for single-trace log at index " + traceIndex);
        }
        return results.get(0);
    }

    private static final class WorkerFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "conformance-align-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
