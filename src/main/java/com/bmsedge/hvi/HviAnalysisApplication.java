package com.bmsedge.hvi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HviAnalysisApplication {
    public static void main(String[] args) {
        SpringApplication.run(HviAnalysisApplication.class, args);
    }
}
