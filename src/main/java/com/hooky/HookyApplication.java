package com.hooky;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HookyApplication {

    public static void main(String[] args) {
        SpringApplication.run(HookyApplication.class, args);
    }
}
