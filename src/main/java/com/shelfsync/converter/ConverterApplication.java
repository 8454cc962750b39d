package com.shelfsync.converter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ConverterApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(ConverterApplication.class);
        // one-shot sync runs without the HTTP server
        for (String arg : args) {
            if (arg.equals("--sync.run=true") || arg.equals("--sync.run")) {
                app.setWebApplicationType(WebApplicationType.NONE);
                break;
            }
        }
        app.run(args);
    }
}
