package com.legalai.docversion.config;

import org.junit.jupiter.api.Test;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class VersioningConfigTest {

    private final VersioningConfig config = new VersioningConfig();

    @Test
    void diffExecutor_hasBoundedQueueAndFailsFast() {
        ExecutorService executor = config.diffExecutor(2, 5);
        try {
            assertThat(executor).isInstanceOf(ThreadPoolExecutor.class);
            ThreadPoolExecutor pool = (ThreadPoolExecutor) executor;
            assertThat(pool.getCorePoolSize()).isEqualTo(2);
            assertThat(pool.getMaximumPoolSize()).isEqualTo(2);
            assertThat(pool.getQueue().remainingCapacity()).isEqualTo(5);
            assertThat(pool.getRejectedExecutionHandler()).isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void diffWorkers_areNamedDaemonThreads() throws Exception {
        ExecutorService executor = config.diffExecutor(1, 1);
        try {
            Thread worker = executor.submit((Callable<Thread>) Thread::currentThread).get(2, TimeUnit.SECONDS);

            assertThat(worker.getName()).startsWith("diff-worker-");
            assertThat(worker.isDaemon()).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }
}
