package com.conflictdata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class ConflictDataApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConflictDataApplication.class, args);
    }
}
