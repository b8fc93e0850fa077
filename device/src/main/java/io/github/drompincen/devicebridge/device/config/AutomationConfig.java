package io.github.drompincen.devicebridge.device.config;

import io.github.drompincen.devicebridge.runtime.desktop.AutomationDriver;
import io.github.drompincen.devicebridge.tools.PowerShellWindowControl;
import io.github.drompincen.devicebridge.tools.ProcessShellExecutor;
import io.github.drompincen.devicebridge.tools.RobotAutomationDriver;
import io.github.drompincen.devicebridge.tools.WindowControl;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/** Native collaborators handed to the SPI-loaded tools. */
@Configuration
public class AutomationConfig {

    @Bean
    ProcessShellExecutor shellExecutor(DeviceProperties properties) {
        return new ProcessShellExecutor(properties.getShellTimeout(), Path.of(System.getProperty("user.home")));
    }

    @Bean
    WindowControl windowControl(ProcessShellExecutor shellExecutor) {
        if (ProcessShellExecutor.isWindows()) {
            return new PowerShellWindowControl(shellExecutor::runPowerShellScript);
        }
        return WindowControl.unsupported(System.getProperty("os.name"));
    }

    @Bean
    AutomationDriver automationDriver(WindowControl windowControl) {
        return new RobotAutomationDriver(windowControl);
    }
}
