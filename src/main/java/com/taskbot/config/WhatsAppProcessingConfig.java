package com.taskbot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class WhatsAppProcessingConfig {

    @Bean(name = "whatsappUpdateExecutor")
    public Executor whatsappUpdateExecutor(WhatsAppProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.processingThreads() == null ? 4 : properties.processingThreads());
        int queueCapacity = properties.processingQueueCapacity() == null ? 500 : properties.processingQueueCapacity();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Math.max(50, queueCapacity));
        executor.setThreadNamePrefix("wa-update-");
        executor.initialize();
        return executor;
    }
}
