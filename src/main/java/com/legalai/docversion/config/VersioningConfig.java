package com.legalai.docversion.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableScheduling
public class VersioningConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Pool for diff computation, the only CPU-heavy step. Callers wait on it with a
     * timeout and cancel with interruption.
     *
     * <p>The queue is bounded and a full queue rejects the submission with
     * {@link java.util.concurrent.RejectedExecutionException}. Queued time counts against
     * the caller's timeout, so an unbounded backlog would only turn into timeouts.
     */
    @Bean(name = "diffExecutor", destroyMethod = "shutdownNow")
    public ExecutorService diffExecutor(@Value("${versioning.diff.pool-size:4}") int poolSize,
                                        @Value("${versioning.diff.queue-capacity:32}") int queueCapacity) {
        int threads = Math.max(1, poolSize);
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "diff-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };

        return new ThreadPoolExecutor(
                threads,
                threads,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                threadFactory,
                new ThreadPoolExecutor.AbortPolicy()) {
            @Override
            protected void beforeExecute(Thread thread, Runnable task) {
                // A cancelled diff may leave the worker interrupted
                if (thread.isInterrupted()) {
                    Thread.interrupted();
                }
                super.beforeExecute(thread, task);
            }
        };
    }
}
