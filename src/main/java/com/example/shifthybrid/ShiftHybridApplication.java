package com.example.shifthybrid;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShiftHybridApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShiftHybridApplication.class, args);
    }
}
