package com.macroallocator.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AnalysisEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnalysisEngineApplication.class, args);
    }
}
