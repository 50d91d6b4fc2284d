package com.eventvalidate.supportchat.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.chat.store")
public record ChatStoreProperties(
        int executorThreads,
        int executorQueueCapacity
) {
    public ChatStoreProperties {
        if (executorThreads <= 0) executorThreads = 4;
        if (executorQueueCapacity <= 0) executorQueueCapacity = 1000;
    }
}
