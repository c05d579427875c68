package com.modelrouter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ModelRouterApplication {
    public static void main(String[] args) {
        SpringApplication.run(ModelRouterApplication.class, args);
    }
}
