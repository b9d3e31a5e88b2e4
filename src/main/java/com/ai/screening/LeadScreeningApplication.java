package com.ai.screening;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LeadScreeningApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeadScreeningApplication.class, args);
    }
}
