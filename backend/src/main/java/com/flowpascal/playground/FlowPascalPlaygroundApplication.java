package com.flowpascal.playground;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FlowPascalPlaygroundApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowPascalPlaygroundApplication.class, args);
    }
}
