package com.toolfinder.search.execution;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SearchExecutionConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService searchExecutor(@Value("${search.execution.pool-size:8}") int poolSize) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(2, poolSize), runnable -> {
            Thread thread = new Thread(runnable, "vector-search-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
