package com.rdparser.playground;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RdParserPlaygroundApplication {

    public static void main(String[] args) {
        SpringApplication.run(RdParserPlaygroundApplication.class, args);
    }
}
