package com.longevitydigest.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LongevityDigestApplication {

    public static void main(String[] args) {
        SpringApplication.run(LongevityDigestApplication.class, args);
    }
}
