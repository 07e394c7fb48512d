package com.starscape.albumpublisher.common.config;

import jakarta.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors for the two fan-out levels of the pipeline.
 *
 * Album tasks block on their file tasks, so the two levels never share a pool.
 * A limit of 0 (the default) means one thread per in-flight task.
 */
@Configuration
public class ExecutorConfig {

    private final List<ExecutorService> executors = new ArrayList<>();

    @Bean
    public ExecutorService albumExecutor(ProcessingProperties processingProperties) {
        return register(create(processingProperties.getMaxParallelAlbums(), "album-"));
    }

    @Bean
    public ExecutorService fileExecutor(ProcessingProperties processingProperties) {
        return register(create(processingProperties.getMaxParallelFiles(), "derive-"));
    }

    @PreDestroy
    public void shutdown() {
        executors.forEach(ExecutorService::shutdown);
    }

    private ExecutorService register(ExecutorService executor) {
        executors.add(executor);
        return executor;
    }

    static ExecutorService create(int limit, String threadPrefix) {
        ThreadFactory threadFactory = new NamedThreadFactory(threadPrefix);
        if (limit > 0) {
            return Executors.newFixedThreadPool(limit, threadFactory);
        }
        return Executors.newCachedThreadPool(threadFactory);
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
