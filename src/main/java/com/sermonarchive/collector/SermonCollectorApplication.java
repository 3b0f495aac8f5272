package com.sermonarchive.collector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SermonCollectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SermonCollectorApplication.class, args);
    }
}
