package com.example.milestoneservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MilestoneServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MilestoneServiceApplication.class, args);
    }
}
