package com.vettriage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TriageEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TriageEngineApplication.class, args);
    }
}
