package com.helmet.corpus.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    @Bean(name = "pipelineTaskExecutor")
    public Executor pipelineTaskExecutor(PipelineProperties properties) {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("pipeline-");
        executor.setConcurrencyLimit(properties.workerConcurrency());
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
