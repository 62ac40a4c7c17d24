package com.flagship.property_acquisition;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PropertyAcquisitionApplication {

    public static void main(String[] args) {
        SpringApplication.run(PropertyAcquisitionApplication.class, args);
    }
}
