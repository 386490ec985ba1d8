package com.production.pdf_analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PdfAnalysisServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PdfAnalysisServiceApplication.class, args);
    }
}
