package com.abba.pillnow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PillNowApplication {

    public static void main(String[] args) {
        SpringApplication.run(PillNowApplication.class, args);
    }
}
