package com.relaymail.service;

import com.relaymail.config.RelayMailProperties;
import com.relaymail.mapper.ApiKeyMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded single-consumer queue for best-effort state writes that must stay off the
 * authentication path.
 *
 * - Enqueueing never blocks; when full, the oldest pending update is dropped
 * - Updates are applied one at a time on a dedicated thread
 * - A failed update is logged and dropped, never retried
 * - On shutdown, new updates are refused and pending ones are drained
 */
@Slf4j
@Service
public class BackgroundTaskQueue {

    private final ApiKeyMapper apiKeyMapper;
    private final Duration shutdownTimeout;

    private final Sinks.Many<LastUsedAtUpdate> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final Scheduler scheduler = Schedulers.newSingle("background-tasks", true);
    private final CountDownLatch drained = new CountDownLatch(1);
    private final AtomicLong droppedCount = new AtomicLong();
    private final AtomicLong processedCount = new AtomicLong();
    private final Disposable subscription;

    private boolean accepting = true;

    public BackgroundTaskQueue(ApiKeyMapper apiKeyMapper, RelayMailProperties properties) {
        this.apiKeyMapper = apiKeyMapper;
        this.shutdownTimeout = properties.getBackgroundQueue().getShutdownTimeout();

        int capacity = properties.getBackgroundQueue().getCapacity();
        this.subscription = sink.asFlux()
                .onBackpressureBuffer(capacity, this::onDropped, BufferOverflowStrategy.DROP_OLDEST)
                .publishOn(scheduler, 1)
                .subscribe(this::apply,
                        error -> {
                            log.error("Background task queue terminated unexpectedly", error);
                            drained.countDown();
                        },
                        drained::countDown);
        log.info("Background task queue started (capacity: {})", capacity);
    }

    /**
     * Queue a last-used timestamp update for an API key.
     *
     * @return false if the update was ignored (blank key or queue shut down)
     */
    public boolean queueLastUsedAtUpdate(String keyId, Instant timestamp) {
        if (keyId == null || keyId.isBlank()) {
            return false;
        }
        synchronized (sink) {
            if (!accepting) {
                log.debug("Background task queue is shut down, ignoring update for key {}", keyId);
                return false;
            }
            Sinks.EmitResult result = sink.tryEmitNext(new LastUsedAtUpdate(keyId, timestamp));
            if (result.isFailure()) {
                log.warn("Could not queue last-used update for key {}: {}", keyId, result);
                return false;
            }
        }
        return true;
    }

    private void apply(LastUsedAtUpdate update) {
        try {
            apiKeyMapper.updateLastUsed(update.keyId(), update.timestamp());
            processedCount.incrementAndGet();
        } catch (RuntimeException e) {
            log.warn("Failed to update last-used timestamp for key {}, dropping update", update.keyId(), e);
        }
    }

    private void onDropped(LastUsedAtUpdate update) {
        long total = droppedCount.incrementAndGet();
        log.warn("Background task queue full, dropped oldest update for key {} (dropped so far: {})",
                update.keyId(), total);
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    public long getProcessedCount() {
        return processedCount.get();
    }

    @PreDestroy
    public void shutdown() {
        synchronized (sink) {
            if (!accepting) {
                return;
            }
            accepting = false;
            sink.tryEmitComplete();
        }

        log.info("Draining background task queue...");
        try {
            if (!drained.await(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Background task queue did not drain within {}s", shutdownTimeout.toSeconds());
                subscription.dispose();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining background task queue");
            subscription.dispose();
        } finally {
            scheduler.dispose();
        }
        log.info("Background task queue stopped ({} applied, {} dropped)", processedCount.get(), droppedCount.get());
    }
}
