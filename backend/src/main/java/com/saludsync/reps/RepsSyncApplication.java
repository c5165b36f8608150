package com.saludsync.reps;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RepsSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(RepsSyncApplication.class, args);
    }
}
