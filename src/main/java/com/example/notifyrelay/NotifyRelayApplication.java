package com.example.notifyrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class NotifyRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(NotifyRelayApplication.class, args);
    }

}
