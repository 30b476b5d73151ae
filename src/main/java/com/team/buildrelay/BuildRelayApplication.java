package com.team.buildrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BuildRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(BuildRelayApplication.class, args);
    }
}
