package com.example.medialibrary.common.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutionConfig.class);

    private static final long SHUTDOWN_GRACE_SECONDS = 5L;

    private ExecutorService libraryScanExecutor;

    /**
     * Single worker: every catalog write made by a scan happens on this thread.
     */
    @Bean
    public ExecutorService libraryScanExecutor() {
        this.libraryScanExecutor = new ThreadPoolExecutor(
                1,
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(1),
                new NamedThreadFactory("library-scan-"),
                new ThreadPoolExecutor.AbortPolicy());
        return this.libraryScanExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (libraryScanExecutor == null) {
            return;
        }
        libraryScanExecutor.shutdown();
        try {
            if (!libraryScanExecutor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("LIBRARY_SCAN_EXECUTOR_FORCED_SHUTDOWN graceSec={}", SHUTDOWN_GRACE_SECONDS);
                libraryScanExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            libraryScanExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
