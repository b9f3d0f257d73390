package com.efaktur.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool that runs validation pipelines (OCR, DJP lookup) off the servlet threads.
 */
@Configuration
public class AsyncExecutorConfig {

    public static final String VALIDATION_EXECUTOR = "validationTaskExecutor";

    @Bean(name = VALIDATION_EXECUTOR)
    public ThreadPoolTaskExecutor validationTaskExecutor(ValidationProperties validationProperties) {
        ValidationProperties.Executor settings = validationProperties.getExecutor();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, settings.getCorePoolSize()));
        executor.setMaxPoolSize(Math.max(settings.getCorePoolSize(), settings.getMaxPoolSize()));
        executor.setQueueCapacity(Math.max(0, settings.getQueueCapacity()));
        executor.setThreadNamePrefix("efaktur-validate-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
