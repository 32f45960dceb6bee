package com.example.transfersim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TransferSimApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransferSimApplication.class, args);
    }
}
