package com.eventvalidate.supportchat.common.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ChatStoreProperties.class)
public class ChatBrokerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs durable session writes so callers can bound how long they wait on the database.
     */
    @Bean(name = "chatStoreExecutor")
    public ThreadPoolTaskExecutor chatStoreExecutor(ChatStoreProperties props) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("chat-store-");
        executor.setCorePoolSize(props.executorThreads());
        executor.setMaxPoolSize(props.executorThreads());
        executor.setQueueCapacity(props.executorQueueCapacity());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
