package com.resumeparse.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.resumeparse")
public class ResumeParseApiApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(ResumeParseApiApplication.class, args);
    }
}
