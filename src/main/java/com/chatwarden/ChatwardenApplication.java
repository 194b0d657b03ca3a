package com.chatwarden;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ChatwardenApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatwardenApplication.class, args);
    }
}
