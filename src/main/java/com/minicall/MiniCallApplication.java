package com.minicall;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class MiniCallApplication {

    public static void main(String[] args) {
        SpringApplication.run(MiniCallApplication.class, args);
    }
}
