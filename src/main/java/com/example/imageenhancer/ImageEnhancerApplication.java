package com.example.imageenhancer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ImageEnhancerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImageEnhancerApplication.class, args);
    }
}
