package io.github.drompincen.devicebridge.device.agent;

import io.github.drompincen.devicebridge.device.config.DeviceProperties;
import io.github.drompincen.devicebridge.runtime.agent.AbortSignal;
import io.github.drompincen.devicebridge.runtime.agent.AgentLoop;
import io.github.drompincen.devicebridge.runtime.agent.AgentLoopFactory;
import io.github.drompincen.devicebridge.runtime.agent.AgentRunListener;
import io.github.drompincen.devicebridge.runtime.agent.AgentRunResult;
import io.github.drompincen.devicebridge.runtime.agent.ModelCallException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeviceAgentServiceTest {

    @Mock private AgentLoopFactory factory;
    @Mock private AgentLoop loop;

    private DeviceAgentService service;

    @BeforeEach
    void setUp() {
        DeviceProperties properties = new DeviceProperties();
        properties.setDeviceName(" laptop ");
        when(factory.create("laptop")).thenReturn(loop);
        service = new DeviceAgentService(factory, properties);
    }

    @Test
    void usesConfiguredNameAsSession() {
        assertThat(service.getDeviceName()).isEqualTo("laptop");
        verify(factory).create("laptop");
    }

    @Test
    void returnsAgentText() {
        when(loop.run(eq("open settings"), any(), any()))
                .thenReturn(new AgentRunResult("Settings are open.", AgentRunResult.Outcome.COMPLETED, 3));

        assertThat(service.runTask("open settings", AgentRunListener.NONE, AbortSignal.none()))
                .isEqualTo("Settings are open.");
    }

    @Test
    void failureBecomesErrorText() {
        when(loop.run(any(), any(), any())).thenThrow(new ModelCallException("model call failed after 3 attempt(s)", null));

        assertThat(service.runTask("task", AgentRunListener.NONE, AbortSignal.none()))
                .isEqualTo("[Error] Local agent failed: model call failed after 3 attempt(s)");
    }

    @Test
    void resetDelegatesToLoop() {
        service.reset();

        verify(loop).reset();
    }

    @Test
    void blankNameFallsBackToHostName() {
        assertThat(DeviceAgentService.resolveDeviceName("  ")).isNotBlank();
    }
}
