package com.taxana;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaxanaApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaxanaApplication.class, args);
    }
}
