package com.koni.greenhouse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GreenhouseApplication {

    public static void main(String[] args) {
        SpringApplication.run(GreenhouseApplication.class, args);
    }
}
