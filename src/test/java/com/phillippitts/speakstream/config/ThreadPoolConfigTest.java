package com.phillippitts.speakstream.config;

import com.phillippitts.speakstream.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    @AfterEach
    void clearContext() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateExecutorWithDefaultSizing() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        Executor executor = config.sessionExecutor();

        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor taskExecutor = (ThreadPoolTaskExecutor) executor;
        try {
            assertThat(taskExecutor.getCorePoolSize()).isEqualTo(8);
            assertThat(taskExecutor.getMaxPoolSize()).isEqualTo(32);
            assertThat(taskExecutor.getThreadNamePrefix()).isEqualTo("session-pool-");
        } finally {
            taskExecutor.shutdown();
        }
    }

    @Test
    void shouldHonorCustomSizing() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getSession().setCorePoolSize(2);
        properties.getSession().setMaxPoolSize(3);
        properties.getSession().setThreadNamePrefix("custom-");

        ThreadPoolTaskExecutor taskExecutor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(properties).sessionExecutor();
        try {
            assertThat(taskExecutor.getCorePoolSize()).isEqualTo(2);
            assertThat(taskExecutor.getMaxPoolSize()).isEqualTo(3);
            assertThat(taskExecutor.getThreadNamePrefix()).isEqualTo("custom-");
        } finally {
            taskExecutor.shutdown();
        }
    }

    @Test
    void shouldHandleConcurrentTasks() throws InterruptedException {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).sessionExecutor();

        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completedTasks = new AtomicInteger(0);

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                try {
                    Thread.sleep(10);
                    completedTasks.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completedTasks.get()).isEqualTo(taskCount);
        executor.shutdown();
    }

    @Test
    void propagatesThreadContextToWorkers() throws InterruptedException {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).sessionExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        ThreadContext.put("sessionId", "abc");
        executor.execute(() -> {
            seen.set(ThreadContext.get("sessionId"));
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("abc");
        executor.shutdown();
    }

    @Test
    void decoratorRestoresWorkerContextAfterTask() {
        ThreadContext.put("sessionId", "submitter");
        Runnable decorated = ThreadPoolConfig.threadContextPropagator().decorate(
                () -> assertThat(ThreadContext.get("sessionId")).isEqualTo("submitter"));

        ThreadContext.clearAll();
        ThreadContext.put("sessionId", "worker");
        decorated.run();

        assertThat(ThreadContext.get("sessionId")).isEqualTo("worker");
    }

    @Test
    void saturatedPoolRunsTaskOnCaller() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getSession().setCorePoolSize(1);
        properties.getSession().setMaxPoolSize(1);
        properties.getSession().setQueueCapacity(1);
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(properties).sessionExecutor();
        CountDownLatch block = new CountDownLatch(1);
        AtomicReference<String> ranOn = new AtomicReference<>();
        try {
            executor.execute(() -> {
                try {
                    block.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            executor.execute(() -> { });
            executor.execute(() -> ranOn.set(Thread.currentThread().getName()));

            assertThat(ranOn.get()).isEqualTo(Thread.currentThread().getName());
        } finally {
            block.countDown();
            executor.shutdown();
        }
    }

    @Test
    void shutDownPoolRejectsInsteadOfDroppingSilently() {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).sessionExecutor();
        ThreadPoolExecutor pool = executor.getThreadPoolExecutor();
        pool.shutdown();

        assertThatThrownBy(() -> pool.execute(() -> { }))
                .isInstanceOf(RejectedExecutionException.class);
    }

    @Test
    void recognitionExecutorIsSingleWorker() throws InterruptedException {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).recognitionExecutor();
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(5);
        try {
            for (int i = 0; i < 5; i++) {
                executor.execute(() -> {
                    maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                    try {
                        Thread.sleep(10);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    inFlight.decrementAndGet();
                    done.countDown();
                });
            }
            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(maxInFlight.get()).isEqualTo(1);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("recognizer-");
        } finally {
            executor.shutdown();
        }
    }
}
