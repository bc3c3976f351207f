package com.entity.extraction.api;

import com.entity.extraction.core.model.Entity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Thread-pool implementation of {@link AsyncEntityRecognizer}.
 * Each text unit is recognized on a pool thread; units are independent, so no
 * coordination is needed beyond the optional concurrency bound.
 */
public class AsyncEntityRecognizerImpl implements AsyncEntityRecognizer {
    private static final Logger log = LoggerFactory.getLogger(AsyncEntityRecognizerImpl.class);

    private static final long DEFAULT_TIMEOUT_MS = 30_000;

    private final NamedEntityRecognitionService service;
    private final ExecutorService executor;
    private final long timeoutMs;

    public AsyncEntityRecognizerImpl(NamedEntityRecognitionService service) {
        this(service, Runtime.getRuntime().availableProcessors(), DEFAULT_TIMEOUT_MS);
    }

    public AsyncEntityRecognizerImpl(NamedEntityRecognitionService service, int threads, long timeoutMs) {
        if (service == null) {
            throw new IllegalArgumentException("service must not be null");
        }
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be > 0");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        this.service = service;
        this.executor = Executors.newFixedThreadPool(threads);
        this.timeoutMs = timeoutMs;
    }

    @Override
    public CompletableFuture<List<Entity>> recognizeAsync(TextUnit unit) {
        return CompletableFuture.supplyAsync(() -> recognize(unit), executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public CompletableFuture<List<List<Entity>>> recognizeBatchAsync(List<TextUnit> units) {
        List<CompletableFuture<List<Entity>>> futures = units.stream()
                .map(this::recognizeAsync)
                .toList();
        return joinAll(futures);
    }

    @Override
    public CompletableFuture<List<List<Entity>>> recognizeBatchAsync(List<TextUnit> units, int maxConcurrency) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be > 0");
        }

        Semaphore semaphore = new Semaphore(maxConcurrency);
        List<CompletableFuture<List<Entity>>> futures = units.stream()
                .map(unit -> CompletableFuture.supplyAsync(() -> {
                    try {
                        semaphore.acquire();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new CompletionException(e);
                    }
                    try {
                        return recognize(unit);
                    } finally {
                        semaphore.release();
                    }
                }, executor).orTimeout(timeoutMs, TimeUnit.MILLISECONDS))
                .toList();
        return joinAll(futures);
    }

    private List<Entity> recognize(TextUnit unit) {
        if (unit == null) {
            throw new IllegalArgumentException("unit must not be null");
        }
        log.debug("recognition.async.start sourceId={} tenantId={}", unit.sourceId(), unit.tenantId());
        return service.extractEntities(unit.text(), unit.sourceId(), unit.tenantId(), unit.options());
    }

    private static CompletableFuture<List<List<Entity>>> joinAll(List<CompletableFuture<List<Entity>>> futures) {
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList());
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
