package com.example.assoc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AssociativeCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssociativeCacheApplication.class, args);
    }
}
