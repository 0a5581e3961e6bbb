package com.olap.bench.service.dispatch;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import com.olap.bench.util.CorrelationIdFilter;

import lombok.extern.slf4j.Slf4j;

/**
 * Producer, fixed worker pool and completion barrier connected by FIFO queues.
 *
 * <pre>
 *   source ──► [work queue] ──► W workers ──► [results queue] ──► reader
 *                                   │
 *            completion barrier ────┘ (end marker after the last worker)
 * </pre>
 *
 * One producer thread copies the source into a bounded work queue and then
 * hands one end marker to each worker. Each worker applies the task to
 * every item it takes and puts the task's outputs on the results queue. Once
 * the producer and all workers are done, the end marker is put on the
 * results queue, so a reader iterating this pipeline terminates.
 *
 * A task that throws does not stop its worker or its siblings: the error is
 * logged, the worker moves on, and the first such error is rethrown to the
 * reader after the last output has been read. The same holds for an error
 * raised while producing items.
 *
 * The correlation id of the starting thread is set on every pipeline thread.
 *
 * A pipeline is single-use: it starts in {@link #start} and can be iterated
 * once. {@link #close()} stops all threads, also when the reader gives up
 * early.
 *
 * @param <I> work item type
 * @param <O> output type
 */
@Slf4j
public final class WorkerPipeline<I, O> implements Iterable<O>, AutoCloseable {

    private final BlockingQueue<Envelope<I>> workQueue;
    private final BlockingQueue<Envelope<O>> resultQueue;
    private final ExecutorService executor;
    private final AtomicReference<RuntimeException> firstError = new AtomicReference<>();
    private final AtomicBoolean iterated = new AtomicBoolean();

    private WorkerPipeline(String name, int workers, int workQueueCapacity, int resultQueueCapacity) {
        this.workQueue = new ArrayBlockingQueue<>(workQueueCapacity);
        this.resultQueue = resultQueueCapacity > 0
            ? new ArrayBlockingQueue<>(resultQueueCapacity)
            : new LinkedBlockingQueue<>();
        this.executor = Executors.newFixedThreadPool(workers + 1, new CustomizableThreadFactory(name + "-"));
    }

    /**
     * Starts a pipeline.
     *
     * @param name thread name prefix
     * @param source items to process, consumed by the producer thread only
     * @param workers number of workers, at least 1
     * @param workQueueCapacity capacity of the work queue, at least 1
     * @param resultQueueCapacity capacity of the results queue, 0 for unbounded
     * @param task applied by a worker to one item; may return any number of outputs
     * @return the running pipeline
     * @throws IllegalArgumentException if a size is out of range
     */
    public static <I, O> WorkerPipeline<I, O> start(
            String name,
            Iterator<I> source,
            int workers,
            int workQueueCapacity,
            int resultQueueCapacity,
            Function<I, List<O>> task) {

        if (workers < 1) {
            throw new IllegalArgumentException("Worker count must be at least 1, was " + workers);
        }
        if (workQueueCapacity < 1) {
            throw new IllegalArgumentException("Work queue capacity must be at least 1, was " + workQueueCapacity);
        }
        if (resultQueueCapacity < 0) {
            throw new IllegalArgumentException("Result queue capacity must not be negative, was " + resultQueueCapacity);
        }

        WorkerPipeline<I, O> pipeline = new WorkerPipeline<>(name, workers, workQueueCapacity, resultQueueCapacity);
        pipeline.launch(source, workers, task);
        return pipeline;
    }

    private void launch(Iterator<I> source, int workers, Function<I, List<O>> task) {
        String correlationId = CorrelationIdFilter.getCurrentCorrelationId();

        List<CompletableFuture<Void>> futures = new ArrayList<>(workers + 1);
        futures.add(CompletableFuture.runAsync(
            () -> withCorrelationId(correlationId, () -> produce(source, workers)), executor));
        for (int i = 0; i < workers; i++) {
            futures.add(CompletableFuture.runAsync(
                () -> withCorrelationId(correlationId, () -> work(task)), executor));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
            .whenComplete((ignored, error) -> {
                if (error != null) {
                    log.debug("Pipeline thread ended abnormally: {}", error.getMessage());
                }
                putQuietly(resultQueue, Envelope.end());
            });
    }

    private void produce(Iterator<I> source, int workers) {
        try {
            while (source.hasNext()) {
                workQueue.put(Envelope.of(source.next()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (RuntimeException e) {
            log.error("Producer failed: {}", e.getMessage(), e);
            firstError.compareAndSet(null, e);
        }
        for (int i = 0; i < workers; i++) {
            putQuietly(workQueue, Envelope.end());
        }
    }

    private void work(Function<I, List<O>> task) {
        try {
            while (true) {
                Envelope<I> item = workQueue.take();
                if (item.isEnd()) {
                    return;
                }
                List<O> outputs;
                try {
                    outputs = task.apply(item.value());
                } catch (RuntimeException e) {
                    log.error("Worker task failed: {}", e.getMessage(), e);
                    firstError.compareAndSet(null, e);
                    continue;
                }
                for (O output : outputs) {
                    resultQueue.put(Envelope.of(output));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Drains the results queue. Blocks while workers are still running.
     *
     * @throws IllegalStateException if called twice
     */
    @Override
    public Iterator<O> iterator() {
        if (!iterated.compareAndSet(false, true)) {
            throw new IllegalStateException("Pipeline results can only be iterated once");
        }
        return new Iterator<>() {
            private Envelope<O> next;
            private boolean finished;

            @Override
            public boolean hasNext() {
                if (next != null) {
                    return true;
                }
                if (finished) {
                    return false;
                }
                Envelope<O> taken;
                try {
                    taken = resultQueue.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while reading pipeline results", e);
                }
                if (taken.isEnd()) {
                    finished = true;
                    executor.shutdown();
                    RuntimeException error = firstError.get();
                    if (error != null) {
                        throw error;
                    }
                    return false;
                }
                next = taken;
                return true;
            }

            @Override
            public O next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                O value = next.value();
                next = null;
                return value;
            }
        };
    }

    /**
     * Collects every output. Convenience for callers that need the whole result set.
     */
    public List<O> drain() {
        List<O> outputs = new ArrayList<>();
        for (O output : this) {
            outputs.add(output);
        }
        return outputs;
    }

    @Override
    public void close() {
        if (!executor.isTerminated()) {
            executor.shutdownNow();
        }
    }

    private static void withCorrelationId(String correlationId, Runnable body) {
        CorrelationIdFilter.setCorrelationId(correlationId);
        try {
            body.run();
        } finally {
            CorrelationIdFilter.clearCorrelationId();
        }
    }

    private static <T> void putQuietly(BlockingQueue<Envelope<T>> queue, Envelope<T> envelope) {
        try {
            queue.put(envelope);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while signalling end of input");
        }
    }

    private record Envelope<T>(T value, boolean isEnd) {

        static <T> Envelope<T> of(T value) {
            return new Envelope<>(value, false);
        }

        static <T> Envelope<T> end() {
            return new Envelope<>(null, true);
        }
    }
}
