package com.cognisync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CognisyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(CognisyncApplication.class, args);
    }
}
