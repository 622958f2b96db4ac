package com.poc.salesingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SalesIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesIngestApplication.class, args);
    }
}
