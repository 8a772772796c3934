package com.courtrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CourtRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(CourtRagApplication.class, args);
    }
}
