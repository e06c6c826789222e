package com.proteincollector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProteinCollectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProteinCollectorApplication.class, args);
    }
}
