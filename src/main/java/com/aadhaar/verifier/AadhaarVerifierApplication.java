package com.aadhaar.verifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AadhaarVerifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(AadhaarVerifierApplication.class, args);
    }
}
