package io.github.manjago.evoformula.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.ToDoubleFunction;

/**
 * Scores candidates on a fixed-size worker pool.
 * <p>
 * One task per candidate; {@link #score(List)} blocks until every task of the
 * batch has finished, so each call is a synchronous barrier. There is no
 * timeout: a slow fitness function stalls the batch.
 */
public class ParallelScorer<T> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ParallelScorer.class);

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final ToDoubleFunction<T> fitness;
    private final ExecutorService pool;
    private final int threads;

    public ParallelScorer(ToDoubleFunction<T> fitness, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1: " + threads);
        }
        this.fitness = fitness;
        this.threads = threads;
        this.pool = Executors.newFixedThreadPool(threads, workerFactory());
    }

    /**
     * Score all candidates, keeping their order.
     *
     * @throws ScoringException if any evaluation throws or the caller is interrupted
     */
    public List<Scored<T>> score(List<T> candidates) {
        List<Future<Scored<T>>> futures = new ArrayList<>(candidates.size());
        for (T candidate : candidates) {
            futures.add(pool.submit(() -> new Scored<>(candidate, fitness.applyAsDouble(candidate))));
        }

        List<Scored<T>> scored = new ArrayList<>(candidates.size());
        try {
            for (Future<Scored<T>> future : futures) {
                scored.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new ScoringException("Fitness evaluation interrupted", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            throw new ScoringException("Exception during fitness evaluation", e.getCause());
        }
        return scored;
    }

    public int getThreads() {
        return threads;
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Scoring workers did not stop in time, interrupting");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }

    private static ThreadFactory workerFactory() {
        int poolId = POOL_COUNTER.incrementAndGet();
        AtomicInteger workerCounter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable,
                    "scorer-" + poolId + "-" + workerCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
