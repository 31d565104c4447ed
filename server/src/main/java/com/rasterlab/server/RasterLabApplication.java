package com.rasterlab.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RasterLabApplication {

    public static void main(String[] args) {
        SpringApplication.run(RasterLabApplication.class, args);
    }
}
