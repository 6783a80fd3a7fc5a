package com.streamfirst.feedrelay.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FeedRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeedRelayApplication.class, args);
    }
}
