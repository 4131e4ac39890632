package com.example.retrain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RetrainApplication {

    public static void main(String[] args) {
        SpringApplication.run(RetrainApplication.class, args);
    }
}
