package com.nosota.mvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MvaultApplication {
    public static void main(String[] args) {
        SpringApplication.run(MvaultApplication.class, args);
    }
}
