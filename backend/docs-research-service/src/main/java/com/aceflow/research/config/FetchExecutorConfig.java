package com.aceflow.research.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.Map;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class FetchExecutorConfig {

    private final ResearchProperties properties;

    /**
     * 문서 fetch 전용 실행자 (bounded worker pool)
     */
    @Bean(name = "fetchExecutor")
    public ThreadPoolTaskExecutor fetchExecutor() {
        int concurrency = properties.getFetch().getConcurrency();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("research-fetch-");
        executor.setTaskDecorator(mdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        log.info("Fetch executor initialized: concurrency={}, perHostLimit={}",
                concurrency, properties.getFetch().getPerHostLimit());
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Copies the submitting thread's MDC (runId) into the worker.
     */
    public static TaskDecorator mdcTaskDecorator() {
        return runnable -> {
            Map<String, String> parentMdc = MDC.getCopyOfContextMap();
            return () -> {
                if (parentMdc != null) {
                    MDC.setContextMap(parentMdc);
                }
                try {
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        };
    }
}
