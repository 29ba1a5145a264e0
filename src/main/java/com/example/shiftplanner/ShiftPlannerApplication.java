package com.example.shiftplanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShiftPlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShiftPlannerApplication.class, args);
    }
}
