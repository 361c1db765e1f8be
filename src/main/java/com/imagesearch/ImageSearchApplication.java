package com.imagesearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ImageSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImageSearchApplication.class, args);
    }
}
