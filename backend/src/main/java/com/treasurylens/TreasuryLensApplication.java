package com.treasurylens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TreasuryLensApplication {

    public static void main(String[] args) {
        SpringApplication.run(TreasuryLensApplication.class, args);
    }
}
