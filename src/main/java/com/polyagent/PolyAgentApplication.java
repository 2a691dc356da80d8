package com.polyagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PolyAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(PolyAgentApplication.class, args);
    }
}
