package com.relaymail.service;

import com.relaymail.config.RelayMailProperties;
import com.relaymail.mapper.ApiKeyMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Background last-used update queue tests
 */
@ExtendWith(MockitoExtension.class)
class BackgroundTaskQueueTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    @Mock
    private ApiKeyMapper apiKeyMapper;

    private BackgroundTaskQueue queue;

    private BackgroundTaskQueue newQueue(int capacity) {
        RelayMailProperties properties = new RelayMailProperties();
        properties.getBackgroundQueue().setCapacity(capacity);
        queue = new BackgroundTaskQueue(apiKeyMapper, properties);
        return queue;
    }

    @AfterEach
    void tearDown() {
        if (queue != null) {
            queue.shutdown();
        }
    }

    @Test
    @DisplayName("Queued updates are applied and drained on shutdown")
    void testQueueLastUsedAtUpdate_DrainedOnShutdown() {
        newQueue(100);

        assertThat(queue.queueLastUsedAtUpdate("key-1", NOW)).isTrue();
        assertThat(queue.queueLastUsedAtUpdate("key-2", NOW)).isTrue();
        queue.shutdown();

        verify(apiKeyMapper).updateLastUsed("key-1", NOW);
        verify(apiKeyMapper).updateLastUsed("key-2", NOW);
        assertThat(queue.getProcessedCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Blank key ids are ignored")
    void testQueueLastUsedAtUpdate_BlankKey() {
        newQueue(100);

        assertThat(queue.queueLastUsedAtUpdate(" ", NOW)).isFalse();
        assertThat(queue.queueLastUsedAtUpdate(null, NOW)).isFalse();
        queue.shutdown();

        verify(apiKeyMapper, never()).updateLastUsed(any(), any());
    }

    @Test
    @DisplayName("Updates after shutdown are refused")
    void testQueueLastUsedAtUpdate_AfterShutdown() {
        newQueue(100);
        queue.shutdown();

        assertThat(queue.queueLastUsedAtUpdate("key-1", NOW)).isFalse();
    }

    @Test
    @DisplayName("A failed update is dropped and the queue keeps going")
    void testApply_FailureDoesNotStopQueue() {
        newQueue(100);
        when(apiKeyMapper.updateLastUsed(eq("bad"), any())).thenThrow(new IllegalStateException("database locked"));

        queue.queueLastUsedAtUpdate("bad", NOW);
        queue.queueLastUsedAtUpdate("good", NOW);
        queue.shutdown();

        verify(apiKeyMapper).updateLastUsed("good", NOW);
        assertThat(queue.getProcessedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("When full, the oldest pending update is dropped")
    void testQueueLastUsedAtUpdate_DropOldest() throws Exception {
        newQueue(2);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return 1;
        }).when(apiKeyMapper).updateLastUsed(eq("key-0"), any());

        queue.queueLastUsedAtUpdate("key-0", NOW);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        for (int i = 1; i <= 10; i++) {
            assertThat(queue.queueLastUsedAtUpdate("key-" + i, NOW)).isTrue();
        }
        release.countDown();
        queue.shutdown();

        assertThat(queue.getDroppedCount()).isPositive();
        assertThat(queue.getProcessedCount() + queue.getDroppedCount()).isEqualTo(11);
        verify(apiKeyMapper).updateLastUsed("key-10", NOW);
    }
}
