package com.spinrank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpinrankApplication {
    public static void main(String[] args) {
        SpringApplication.run(SpinrankApplication.class, args);
    }
}
