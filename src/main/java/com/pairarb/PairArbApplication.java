package com.pairarb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PairArbApplication {

    public static void main(String[] args) {
        SpringApplication.run(PairArbApplication.class, args);
    }
}
