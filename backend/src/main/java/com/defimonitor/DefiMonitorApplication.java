package com.defimonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DefiMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DefiMonitorApplication.class, args);
    }
}
