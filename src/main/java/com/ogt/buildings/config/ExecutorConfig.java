package com.ogt.buildings.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfig {

    public static final String EXTRACTION_EXECUTOR = "extractionExecutor";

    // Extracciones por fuente de una misma ejecución (red/disco, sin estado compartido)
    @Bean(name = EXTRACTION_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService extractionExecutor(BuildingExtractorProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "extract-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getExtraction().getThreads()), threadFactory);
    }
}
