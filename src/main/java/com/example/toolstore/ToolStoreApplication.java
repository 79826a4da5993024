package com.example.toolstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ToolStoreApplication {
    public static void main(String[] args) {
        SpringApplication.run(ToolStoreApplication.class, args);
    }
}
