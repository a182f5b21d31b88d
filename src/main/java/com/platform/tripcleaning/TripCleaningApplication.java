package com.platform.tripcleaning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TripCleaningApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TripCleaningApplication.class, args)));
    }
}
