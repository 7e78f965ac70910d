package com.example.jduel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JduelApplication {

    public static void main(String[] args) {
        SpringApplication.run(JduelApplication.class, args);
    }
}
