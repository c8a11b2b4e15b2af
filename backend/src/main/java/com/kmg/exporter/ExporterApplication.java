package com.kmg.exporter;

import com.kmg.exporter.config.ExporterProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ExporterProperties.class)
public class ExporterApplication {
    public static void main(String[] args) {
        SpringApplication.run(ExporterApplication.class, args);
    }
}
