package com.truthbus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TruthBusApplication {

    public static void main(String[] args) {
        SpringApplication.run(TruthBusApplication.class, args);
    }
}
