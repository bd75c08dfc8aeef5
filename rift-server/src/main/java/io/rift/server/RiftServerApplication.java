package io.rift.server;

import io.rift.server.config.RiftServerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Webhook ingestion and stats server.
 */
@SpringBootApplication
@EnableConfigurationProperties(RiftServerProperties.class)
public class RiftServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RiftServerApplication.class, args);
    }
}
