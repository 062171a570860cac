package com.example.logmanager;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LogManagerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogManagerApplication.class, args);
    }

}
