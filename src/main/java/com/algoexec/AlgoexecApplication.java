package com.algoexec;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AlgoexecApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlgoexecApplication.class, args);
    }
}
