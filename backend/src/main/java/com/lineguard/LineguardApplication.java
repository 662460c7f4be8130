package com.lineguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LineguardApplication {

    public static void main(String[] args) {
        SpringApplication.run(LineguardApplication.class, args);
    }
}
