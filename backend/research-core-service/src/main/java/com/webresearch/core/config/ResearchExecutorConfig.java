package com.webresearch.core.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@EnableScheduling
@Slf4j
public class ResearchExecutorConfig {

    @Value("${research.executor.core-pool-size:5}")
    private int corePoolSize;

    @Value("${research.executor.max-pool-size:20}")
    private int maxPoolSize;

    @Value("${research.executor.queue-capacity:100}")
    private int queueCapacity;

    /**
     * 실행 경로(path) 전용 실행자
     */
    @Bean(name = "researchPathExecutor")
    public ThreadPoolTaskExecutor researchPathExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("research-path-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        // saturated pool runs the path on the dispatching thread
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("researchPathExecutor saturated, running on caller: {}", r.toString());
            r.run();
        });
        executor.initialize();
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock researchClock() {
        return Clock.systemUTC();
    }
}
