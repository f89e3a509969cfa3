package com.podvalidation.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PodValidationApplication {

    public static void main(String[] args) {
        SpringApplication.run(PodValidationApplication.class, args);
    }
}
