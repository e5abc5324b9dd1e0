package com.docsum.common.concurrent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CancellableFutures Tests")
class CancellableFuturesTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2, new NamedThreadFactory("test-"));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("should complete with the task's value")
    void shouldCompleteWithValue() throws Exception {
        CompletableFuture<String> future = CancellableFutures.submit(executor, () -> "done");

        assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo("done");
    }

    @Test
    @DisplayName("should complete exceptionally with the exception the task threw")
    void shouldCompleteExceptionally_whenTaskThrows() {
        IllegalStateException failure = new IllegalStateException("boom");

        CompletableFuture<String> future =
                CancellableFutures.submit(
                        executor,
                        () -> {
                            throw failure;
                        });

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isSameAs(failure);
    }

    @Test
    @DisplayName("should interrupt the running task when the future is cancelled")
    void shouldInterruptRunningTask_whenCancelled() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);

        CompletableFuture<String> future =
                CancellableFutures.submit(
                        executor,
                        () -> {
                            started.countDown();
                            try {
                                new CountDownLatch(1).await();
                            } catch (InterruptedException e) {
                                interrupted.countDown();
                                throw e;
                            }
                            return "never";
                        });

        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        future.cancel(true);

        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(future.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("should fail the future when the executor rejects the task")
    void shouldFail_whenExecutorIsShutDown() {
        executor.shutdown();

        CompletableFuture<String> future = CancellableFutures.submit(executor, () -> "late");

        assertThat(future.isCompletedExceptionally()).isTrue();
    }
}
