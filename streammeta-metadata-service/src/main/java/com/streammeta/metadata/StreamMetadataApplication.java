package com.streammeta.metadata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Stream Metadata Application
 * Serves stream schemas, settings and stats, and coordinates stream deletion
 */
@SpringBootApplication
@EnableConfigurationProperties
public class StreamMetadataApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamMetadataApplication.class, args);
    }
}
