package com.flagship.smart_sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SmartSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(SmartSyncApplication.class, args);
    }
}
