package com.replifast.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReplifastApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReplifastApplication.class, args);
    }
}
