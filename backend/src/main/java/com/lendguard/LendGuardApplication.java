package com.lendguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LendGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(LendGuardApplication.class, args);
    }
}
