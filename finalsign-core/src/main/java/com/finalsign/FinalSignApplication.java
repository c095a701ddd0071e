package com.finalsign;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FinalSignApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinalSignApplication.class, args);
    }
}
