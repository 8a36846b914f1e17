package com.eainde.verity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VerityApplication {

    public static void main(String[] args) {
        SpringApplication.run(VerityApplication.class, args);
    }
}
