package com.algoclock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AlgoclockApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlgoclockApplication.class, args);
    }
}
