package com.abba.ainay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AinayApplication {

    public static void main(String[] args) {
        SpringApplication.run(AinayApplication.class, args);
    }
}
