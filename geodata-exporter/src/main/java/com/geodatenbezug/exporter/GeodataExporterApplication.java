package com.geodatenbezug.exporter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class GeodataExporterApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeodataExporterApplication.class, args);
    }
}
