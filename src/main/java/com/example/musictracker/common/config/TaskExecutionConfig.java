package com.example.musictracker.common.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private ExecutorService trackerTaskExecutor;

    @Bean
    public ExecutorService trackerTaskExecutor(AppTrackerProperties appTrackerProperties) {
        int threads = Math.max(1, appTrackerProperties.getTaskThreadCount());
        int queueSize = Math.max(1, appTrackerProperties.getTaskQueueSize());
        this.trackerTaskExecutor = new ThreadPoolExecutor(
                threads,
                threads,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueSize),
                new NamedThreadFactory("tracker-task-"),
                new ThreadPoolExecutor.AbortPolicy());
        return this.trackerTaskExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (trackerTaskExecutor != null) {
            trackerTaskExecutor.shutdown();
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
