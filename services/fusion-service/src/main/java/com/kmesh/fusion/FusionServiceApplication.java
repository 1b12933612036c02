package com.kmesh.fusion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FusionServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(FusionServiceApplication.class, args);
    }
}
