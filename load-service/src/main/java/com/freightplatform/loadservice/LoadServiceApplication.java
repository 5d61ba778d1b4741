package com.freightplatform.loadservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SuppressWarnings("java:S1118")
@SpringBootApplication
public class LoadServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoadServiceApplication.class, args);
    }

}
