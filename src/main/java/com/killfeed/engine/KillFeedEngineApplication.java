package com.killfeed.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class KillFeedEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(KillFeedEngineApplication.class, args);
    }
}
