package com.propertyintel.price;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class PricePredictorApplication {

    public static void main(String[] args) {
        SpringApplication.run(PricePredictorApplication.class, args);
    }
}
