package com.snapimg.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SnapServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SnapServerApplication.class, args);
    }
}
