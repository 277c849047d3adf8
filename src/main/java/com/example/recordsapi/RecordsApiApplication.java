package com.example.recordsapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RecordsApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecordsApiApplication.class, args);
    }
}
