package com.courtrag.config;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;

/**
 * Bounded thread pools for document ingestion, searches and embedding calls.
 * A full queue rejects the task rather than running it on the caller thread.
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    @Bean(name = "ingestionExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor ingestionExecutor(CourtRagProperties properties) {
        return buildExecutor("ingest-", properties.getIngestionThreads(), properties.getQueueCapacity());
    }

    @Bean(name = "searchExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor searchExecutor(CourtRagProperties properties) {
        return buildExecutor("search-", properties.getSearchThreads(), properties.getQueueCapacity());
    }

    @Bean(name = "embeddingExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor embeddingExecutor(CourtRagProperties properties) {
        return buildExecutor("embed-", properties.getEmbeddingThreads(), properties.getQueueCapacity());
    }

    static ThreadPoolExecutor buildExecutor(String prefix, int threads, int queueCapacity) {
        int size = Math.max(1, threads);
        int queue = Math.max(10, queueCapacity);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(size, size, 30L, TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(queue), new NamedThreadFactory(prefix), new MonitoredRejectionHandler(prefix));
        executor.allowCoreThreadTimeOut(true);
        log.info("Thread pool '{}' initialized: threads={}, queue={}", prefix, size, queue);
        return executor;
    }

    public static final class MonitoredRejectionHandler implements RejectedExecutionHandler {

        private final String poolName;
        private final AtomicLong rejectionCount = new AtomicLong(0);

        public MonitoredRejectionHandler(String poolName) {
            this.poolName = poolName;
        }

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            long count = rejectionCount.incrementAndGet();
            log.warn("Task rejected from pool '{}', queue full. active={}, queueSize={}, totalRejections={}",
                poolName, executor.getActiveCount(), executor.getQueue().size(), count);
            throw new RejectedExecutionException("Thread pool '" + poolName + "' overloaded (rejected " + count + " tasks)");
        }

        public long getRejectionCount() {
            return rejectionCount.get();
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
