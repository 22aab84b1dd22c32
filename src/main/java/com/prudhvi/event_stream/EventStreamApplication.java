package com.prudhvi.event_stream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EventStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventStreamApplication.class, args);
    }
}
