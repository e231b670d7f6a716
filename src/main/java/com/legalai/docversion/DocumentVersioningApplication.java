package com.legalai.docversion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocumentVersioningApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocumentVersioningApplication.class, args);
    }
}
