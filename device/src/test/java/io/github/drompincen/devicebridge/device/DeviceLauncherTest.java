package io.github.drompincen.devicebridge.device;

import io.github.drompincen.devicebridge.device.agent.DeviceAgentService;
import io.github.drompincen.devicebridge.device.client.BridgeClient;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class DeviceLauncherTest {

    private final BridgeClient client = mock(BridgeClient.class);
    private final DeviceAgentService agent = mock(DeviceAgentService.class);
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final DeviceLauncher launcher =
            new DeviceLauncher(client, agent, new PrintStream(buffer, true, StandardCharsets.UTF_8));

    @Test
    void withoutTaskConnectsToHub() {
        launcher.run(new DefaultApplicationArguments());

        verify(client).start();
        assertThat(launcher.isStandalone()).isFalse();
    }

    @Test
    void taskOptionRunsLocallyAndPrintsResult() {
        when(agent.runTask(eq("open notepad"), any(), any())).thenReturn("Notepad is open.");

        launcher.run(new DefaultApplicationArguments("--task=open notepad"));

        verify(client, never()).start();
        assertThat(launcher.isStandalone()).isTrue();
        assertThat(buffer.toString(StandardCharsets.UTF_8)).isEqualTo("Notepad is open." + System.lineSeparator());
    }
}
