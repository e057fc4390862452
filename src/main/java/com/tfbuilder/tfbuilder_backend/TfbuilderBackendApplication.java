package com.tfbuilder.tfbuilder_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TfbuilderBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(TfbuilderBackendApplication.class, args);
    }
}
