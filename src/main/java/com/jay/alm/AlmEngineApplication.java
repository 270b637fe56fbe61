package com.jay.alm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AlmEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(AlmEngineApplication.class, args);
    }
}
