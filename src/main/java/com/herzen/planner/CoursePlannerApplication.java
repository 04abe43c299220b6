package com.herzen.planner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CoursePlannerApplication {
    public static void main(String[] args) {
        SpringApplication.run(CoursePlannerApplication.class, args);
    }
}
