package com.example.diversifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DiversifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiversifierApplication.class, args);
    }
}
