package com.causalgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CausalGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(CausalGraphApplication.class, args);
    }
}
