package com.lynkvertx.lcce;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * LCCE - Logistics Cost Calculation Engine
 * Main application entry point
 */
@SpringBootApplication
public class LcceApplication {

    public static void main(String[] args) {
        SpringApplication.run(LcceApplication.class, args);
    }
}
