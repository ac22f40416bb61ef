package com.changedetection;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ChangeDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChangeDetectionApplication.class, args);
    }
}
