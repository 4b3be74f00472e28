package com.netbet.pubsub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PubSubSessionApplication {

    public static void main(String[] args) {
        SpringApplication.run(PubSubSessionApplication.class, args);
    }
}
