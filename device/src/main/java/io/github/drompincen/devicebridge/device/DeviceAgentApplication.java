package io.github.drompincen.devicebridge.device;

import io.github.drompincen.devicebridge.device.config.DeviceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication(scanBasePackages = {
        "io.github.drompincen.devicebridge.device",
        "io.github.drompincen.devicebridge.runtime"
})
@EnableConfigurationProperties(DeviceProperties.class)
public class DeviceAgentApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(DeviceAgentApplication.class);
        // java.awt.Robot needs a display
        app.setHeadless(false);
        ConfigurableApplicationContext context = app.run(args);
        if (context.getBean(DeviceLauncher.class).isStandalone()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
