package com.naagi.kb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NaagiKbServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(NaagiKbServiceApplication.class, args);
    }
}
