package com.foodvision.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncSchedulingConfig {

    /** 一個 scan job 一個 task */
    @Bean("scanJobExecutor")
    public TaskExecutor scanJobExecutor(
            @Value("${app.scan.jobs.core-pool-size:4}") int core,
            @Value("${app.scan.jobs.max-pool-size:8}") int max,
            @Value("${app.scan.jobs.queue-capacity:100}") int queue
    ) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(core);
        ex.setMaxPoolSize(max);
        ex.setQueueCapacity(queue);
        ex.setThreadNamePrefix("scan-job-");
        ex.initialize();
        return ex;
    }

    /**
     * deep scan 每個 crop 都會打 vision model + 營養查詢，固定 10 條避免把外部服務打爆。
     */
    @Bean("segmentExecutor")
    public TaskExecutor segmentExecutor(
            @Value("${app.scan.deep.max-concurrent-crops:10}") int maxConcurrentCrops
    ) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(maxConcurrentCrops);
        ex.setMaxPoolSize(maxConcurrentCrops);
        ex.setQueueCapacity(1000);
        ex.setThreadNamePrefix("segment-");
        ex.initialize();
        return ex;
    }

    /** SSE 推進度用：每條連線占一條 thread 輪詢 event log */
    @Bean("progressStreamExecutor")
    public TaskExecutor progressStreamExecutor(
            @Value("${app.scan.progress.max-streams:64}") int maxStreams
    ) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(8);
        ex.setMaxPoolSize(Math.max(8, maxStreams));
        ex.setQueueCapacity(0);
        ex.setThreadNamePrefix("scan-sse-");
        ex.initialize();
        return ex;
    }
}
