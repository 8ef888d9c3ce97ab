/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.behaviors.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import static org.elasticsoftware.behaviors.dispatch.AggregatePartitionState.*;

/**
 * A single threaded lane of the dispatcher. Processing turns for the same aggregate id run one
 * after the other, including the asynchronous part of a turn; turns for different aggregate ids
 * may interleave while one of them waits.
 */
final class AggregatePartition implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AggregatePartition.class);
    private final String aggregateName;
    private final int id;
    private final Duration shutdownTimeout;
    private final ExecutorService executor;
    // only touched on the partition thread
    private final Map<String, CompletableFuture<?>> lastTurns = new HashMap<>();
    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile AggregatePartitionState processState = PROCESSING;

    AggregatePartition(String aggregateName, int id, Duration shutdownTimeout) {
        this.aggregateName = aggregateName;
        this.id = id;
        this.shutdownTimeout = shutdownTimeout;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, aggregateName + "Aggregate-partition-" + id);
            thread.setDaemon(true);
            return thread;
        });
        logger.info("Started AggregatePartition {} of {}Aggregate", id, aggregateName);
    }

    int getId() {
        return id;
    }

    AggregatePartitionState getProcessState() {
        return processState;
    }

    Executor executor() {
        return executor;
    }

    /**
     * Schedules a turn for the aggregate. The supplier is called on the partition thread once the
     * previous turn for the same aggregate has completed, successfully or not.
     */
    <T> CompletableFuture<T> submit(String aggregateId, Supplier<CompletableFuture<T>> turn) {
        CompletableFuture<T> result = new CompletableFuture<>();
        if (processState != PROCESSING) {
            result.completeExceptionally(shutDown(null));
            return result;
        }
        inFlight.add(result);
        result.whenComplete((value, throwable) -> inFlight.remove(result));
        try {
            executor.execute(() -> chain(aggregateId, turn, result));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(shutDown(e));
        }
        return result;
    }

    private <T> void chain(String aggregateId, Supplier<CompletableFuture<T>> turn, CompletableFuture<T> result) {
        CompletableFuture<?> previous = lastTurns.getOrDefault(aggregateId, CompletableFuture.completedFuture(null));
        CompletableFuture<T> current = previous
                .handle((value, throwable) -> null)
                .thenComposeAsync(ignored -> turn.get(), executor);
        lastTurns.put(aggregateId, current);
        current.whenComplete((value, throwable) -> {
            try {
                executor.execute(() -> {
                    if (lastTurns.get(aggregateId) == current) {
                        lastTurns.remove(aggregateId);
                    }
                });
            } catch (RejectedExecutionException e) {
                logger.trace("AggregatePartition {} of {}Aggregate already shut down", id, aggregateName);
            }
            if (throwable != null) {
                result.completeExceptionally(throwable instanceof CompletionException && throwable.getCause() != null
                        ? throwable.getCause() : throwable);
            } else {
                result.complete(value);
            }
        });
    }

    @Override
    public void close() {
        if (processState != PROCESSING) {
            return;
        }
        processState = SHUTTING_DOWN;
        logger.info("Shutting down AggregatePartition {} of {}Aggregate with {} turns in flight", id, aggregateName, inFlight.size());
        try {
            CompletableFuture.allOf(inFlight.toArray(new CompletableFuture<?>[0]))
                    .get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("AggregatePartition {} of {}Aggregate did not finish {} turns within {}ms",
                    id, aggregateName, inFlight.size(), shutdownTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            // failed turns have already been reported to their callers
            logger.trace("Turn failed during shutdown of AggregatePartition {}", id, e);
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (CompletableFuture<?> abandoned : inFlight) {
            abandoned.completeExceptionally(shutDown(null));
        }
        processState = CLOSED;
        logger.info("Closed AggregatePartition {} of {}Aggregate", id, aggregateName);
    }

    private IllegalStateException shutDown(Throwable cause) {
        return new IllegalStateException("AggregatePartition " + id + " of " + aggregateName + "Aggregate is shut down", cause);
    }
}
