package org.neuralchilli.marshal.worker;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;

class WorkerPoolTest {

    private WorkerPool pool;

    @BeforeEach
    void setup() {
        pool = new WorkerPool("pool-test", 1);
    }

    @AfterEach
    void teardown() {
        pool.shutdown();
    }

    @Test
    void shouldNotCountQueueTimeAgainstTimeout() throws Exception {
        // Given: one thread, two tasks that each fit their timeout on their own
        CompletableFuture<String> first = pool.submit(() -> {
            Thread.sleep(400);
            return "first";
        }, Duration.ofMillis(600));
        CompletableFuture<String> second = pool.submit(() -> {
            Thread.sleep(400);
            return "second";
        }, Duration.ofMillis(600));

        // Then: the second waits ~400ms for the thread and still finishes in time
        assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo("first");
        assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo("second");
    }

    @Test
    void shouldTimeOutAndInterruptRunningTask() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        CompletableFuture<String> slow = pool.submit(() -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "slow";
        }, Duration.ofMillis(150));

        assertThatThrownBy(() -> slow.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(TimeoutException.class);
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();

        // the thread is free again for the next task
        CompletableFuture<String> next = pool.submit(() -> "next", Duration.ofSeconds(1));
        assertThat(next.get(5, TimeUnit.SECONDS)).isEqualTo("next");
    }

    @Test
    void shouldPassHandlerFailureThrough() {
        CompletableFuture<String> failing = pool.submit(() -> {
            throw new IllegalStateException("boom");
        }, Duration.ofSeconds(1));

        assertThatThrownBy(() -> failing.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(IllegalStateException.class)
                .hasMessageContaining("boom");
    }
}
