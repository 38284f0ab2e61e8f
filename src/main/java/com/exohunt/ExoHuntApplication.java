package com.exohunt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExoHuntApplication {

    private static final Logger log = LoggerFactory.getLogger(ExoHuntApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ExoHuntApplication.class, args);
        log.info("ExoHunt light-curve core started.");
        log.info("Health:       GET http://localhost:8080/actuator/health");
    }
}
