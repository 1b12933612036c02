package com.kmesh.router.config;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
@EnableConfigurationProperties(RouterProperties.class)
public class RouterExecutionConfig {

    /**
     * Agent calls never queue: a call that finds every thread busy gets a new one, up to
     * max-pool-size, so one query's slow agents cannot eat another query's budget. Past that
     * cap submissions are rejected and the orchestrator reports the agent as a gap.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fanOutExecutor(RouterProperties properties) {
        int core = Math.max(2, properties.getPoolSize());
        int max = Math.max(core, properties.getMaxPoolSize());
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
            core,
            max,
            60L,
            TimeUnit.SECONDS,
            new SynchronousQueue<>(),
            new CustomizableThreadFactory("router-fanout-"),
            new ThreadPoolExecutor.AbortPolicy()
        );
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService classificationExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("router-classify-"));
    }

    /** Bounded so a dead broker drops events instead of piling them up in memory. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService eventExecutor(RouterProperties properties) {
        int threads = Math.max(1, properties.getEvents().getPoolSize());
        return new ThreadPoolExecutor(
            threads,
            threads,
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(Math.max(1, properties.getEvents().getQueueCapacity())),
            new CustomizableThreadFactory("router-events-"),
            new ThreadPoolExecutor.AbortPolicy()
        );
    }
}
