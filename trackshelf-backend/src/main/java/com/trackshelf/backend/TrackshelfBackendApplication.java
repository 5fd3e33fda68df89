package com.trackshelf.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrackshelfBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrackshelfBackendApplication.class, args);
    }
}
