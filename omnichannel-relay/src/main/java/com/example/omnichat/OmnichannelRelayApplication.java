package com.example.omnichat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class OmnichannelRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(OmnichannelRelayApplication.class, args);
    }
}
