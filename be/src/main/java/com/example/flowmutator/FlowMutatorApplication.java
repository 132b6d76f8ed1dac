package com.example.flowmutator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowMutatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowMutatorApplication.class, args);
    }
}
