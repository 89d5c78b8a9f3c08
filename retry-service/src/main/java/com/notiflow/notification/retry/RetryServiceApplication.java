package com.notiflow.notification.retry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RetryServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(RetryServiceApplication.class, args);
    }
}
