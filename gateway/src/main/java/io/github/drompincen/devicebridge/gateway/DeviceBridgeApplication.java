package io.github.drompincen.devicebridge.gateway;

import io.github.drompincen.devicebridge.gateway.config.HubProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.devicebridge.gateway")
@EnableMongoRepositories(basePackages = "io.github.drompincen.devicebridge.persistence.repository")
@EnableConfigurationProperties(HubProperties.class)
public class DeviceBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeviceBridgeApplication.class, args);
    }
}
