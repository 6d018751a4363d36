package com.market.sensitivity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SensitivityApplication {

    public static void main(String[] args) {
        SpringApplication.run(SensitivityApplication.class, args);
    }
}
