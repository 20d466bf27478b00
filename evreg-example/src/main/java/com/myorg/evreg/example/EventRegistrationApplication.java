package com.myorg.evreg.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EventRegistrationApplication {
    public static void main(String[] args) {
        SpringApplication.run(EventRegistrationApplication.class, args);
    }
}
