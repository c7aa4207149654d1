package com.eainde.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FinancialAnalysisApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinancialAnalysisApplication.class, args);
    }
}
