package com.plantwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PlantWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlantWatchApplication.class, args);
    }
}
