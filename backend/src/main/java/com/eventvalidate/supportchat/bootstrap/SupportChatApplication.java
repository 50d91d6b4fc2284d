package com.eventvalidate.supportchat.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.eventvalidate.supportchat")
@EnableScheduling
public class SupportChatApplication {
    public static void main(String[] args) {
        SpringApplication.run(SupportChatApplication.class, args);
    }
}
