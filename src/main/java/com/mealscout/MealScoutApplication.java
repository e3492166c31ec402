package com.mealscout;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@Slf4j
public class MealScoutApplication {

    public static void main(String[] args) {
        log.info("Starting MealScout backend");
        SpringApplication.run(MealScoutApplication.class, args);
        log.info("MealScout backend started");
    }

}
