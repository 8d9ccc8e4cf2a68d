package com.filingsync.ingestion.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WorkerConfig {

    @Bean(name = "ingestionExecutor", destroyMethod = "shutdown")
    ExecutorService ingestionExecutor(IngestionProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkerThreads());
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
