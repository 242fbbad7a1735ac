package com.caselink;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CaseLinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaseLinkApplication.class, args);
    }
}
