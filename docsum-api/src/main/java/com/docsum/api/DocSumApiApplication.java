package com.docsum.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.docsum")
public class DocSumApiApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(DocSumApiApplication.class, args);
    }
}
