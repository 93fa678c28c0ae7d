package com.example.polystoresync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PolystoreSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(PolystoreSyncApplication.class, args);
    }
}
