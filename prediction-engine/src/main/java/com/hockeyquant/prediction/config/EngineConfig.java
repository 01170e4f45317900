package com.hockeyquant.prediction.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class EngineConfig {

    /**
     * Slate dates follow the league's Eastern-time calendar.
     */
    @Bean
    public Clock clock() {
        return Clock.system(ZoneId.of("America/New_York"));
    }

    @Bean(name = "slateExecutor")
    public ThreadPoolTaskExecutor slateExecutor(EngineProperties properties) {
        int threads = Math.max(1, properties.getParallelism());
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(threads);
        exec.setMaxPoolSize(threads);
        exec.setQueueCapacity(64);
        exec.setThreadNamePrefix("slate-");
        exec.initialize();
        return exec;
    }
}
