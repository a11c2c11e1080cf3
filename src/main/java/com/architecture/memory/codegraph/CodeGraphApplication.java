package com.architecture.memory.codegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CodeGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeGraphApplication.class, args);
    }
}
