package com.continuum.relayer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RelayerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayerApplication.class, args);
    }
}
