package com.entity.extraction.api;

import com.entity.extraction.core.model.Entity;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Async interface for recognizing entities in many text units concurrently.
 * All methods return {@link CompletableFuture} for non-blocking operation.
 */
public interface AsyncEntityRecognizer extends AutoCloseable {

    /**
     * Asynchronously recognizes the entities of one text unit.
     */
    CompletableFuture<List<Entity>> recognizeAsync(TextUnit unit);

    /**
     * Recognizes a batch of text units in parallel. Results are in input order.
     */
    CompletableFuture<List<List<Entity>>> recognizeBatchAsync(List<TextUnit> units);

    /**
     * Recognizes a batch with bounded concurrency.
     *
     * @param units          the text units
     * @param maxConcurrency maximum number of units processed at once
     */
    CompletableFuture<List<List<Entity>>> recognizeBatchAsync(List<TextUnit> units, int maxConcurrency);

    @Override
    void close();
}
