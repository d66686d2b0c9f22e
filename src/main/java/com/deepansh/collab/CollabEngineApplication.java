package com.deepansh.collab;

import com.deepansh.collab.config.CollabProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableAsync
@EnableScheduling
@EnableConfigurationProperties(CollabProperties.class)
public class CollabEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(CollabEngineApplication.class, args);
    }
}
