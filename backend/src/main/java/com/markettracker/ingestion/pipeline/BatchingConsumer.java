package com.markettracker.ingestion.pipeline;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drains fetched records from a bounded queue and persists them in batches of exactly batchSize.
 * After idleTimeout without input the partial buffer is flushed and the consumer keeps waiting;
 * the end-of-stream marker flushes the rest and ends the loop.
 */
@Slf4j
public class BatchingConsumer<T> implements Runnable {

    private final List<T> endOfStream = new ArrayList<>(0);
    private final BlockingQueue<List<T>> queue;
    private final RecordSink<T> sink;
    private final int batchSize;
    private final Duration idleTimeout;
    private final String name;
    private final List<T> buffer = new ArrayList<>();
    private final AtomicInteger persisted = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private volatile boolean finishRequested;

    public BatchingConsumer(RecordSink<T> sink, int batchSize, Duration idleTimeout, int queueCapacity, String name) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.sink = sink;
        this.batchSize = batchSize;
        this.idleTimeout = idleTimeout;
        this.queue = new LinkedBlockingQueue<>(Math.max(1, queueCapacity));
        this.name = name;
    }

    /**
     * Hands one day's records to the consumer; blocks while the queue is full.
     */
    public void accept(List<T> records) throws InterruptedException {
        if (!records.isEmpty()) {
            queue.put(records);
        }
    }

    /**
     * Enqueues the end-of-stream marker behind everything already queued.
     */
    public void finish() throws InterruptedException {
        queue.put(endOfStream);
    }

    /**
     * Asks the consumer to stop without waiting for it: flushes what it has at the next wake-up.
     */
    public void requestFinish() {
        finishRequested = true;
        if (!queue.offer(endOfStream)) {
            log.debug("{}: queue full, consumer will stop on next idle check", name);
        }
    }

    @Override
    public void run() {
        try {
            while (true) {
                List<T> item = queue.poll(idleTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (item == endOfStream) {
                    flushAll();
                    return;
                }
                if (item == null) {
                    if (!buffer.isEmpty()) {
                        log.debug("{}: idle for {}, flushing {} buffered record(s)", name, idleTimeout, buffer.size());
                        flushAll();
                    }
                    if (finishRequested) {
                        return;
                    }
                    continue;
                }
                buffer.addAll(item);
                while (buffer.size() >= batchSize) {
                    List<T> batch = new ArrayList<>(buffer.subList(0, batchSize));
                    buffer.subList(0, batchSize).clear();
                    persist(batch);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{}: consumer interrupted, flushing {} buffered record(s)", name, buffer.size());
            flushAll();
        }
    }

    public int persisted() {
        return persisted.get();
    }

    public int failed() {
        return failed.get();
    }

    private void flushAll() {
        while (!buffer.isEmpty()) {
            int n = Math.min(batchSize, buffer.size());
            List<T> batch = new ArrayList<>(buffer.subList(0, n));
            buffer.subList(0, n).clear();
            persist(batch);
        }
    }

    private void persist(List<T> batch) {
        try {
            persisted.addAndGet(sink.persist(batch));
        } catch (RuntimeException e) {
            failed.addAndGet(batch.size());
            log.error("{}: failed to persist batch of {} record(s)", name, batch.size(), e);
        }
    }
}
