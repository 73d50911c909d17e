package com.xcpradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class XcpRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(XcpRadarApplication.class, args);
    }
}
