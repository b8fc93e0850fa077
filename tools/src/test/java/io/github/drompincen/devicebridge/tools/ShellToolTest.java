package io.github.drompincen.devicebridge.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.devicebridge.runtime.agent.AgentRunListener;
import io.github.drompincen.devicebridge.runtime.perception.ScreenStateHolder;
import io.github.drompincen.devicebridge.runtime.shell.ShellExecutor;
import io.github.drompincen.devicebridge.runtime.shell.ShellResult;
import io.github.drompincen.devicebridge.runtime.tools.ToolBindings;
import io.github.drompincen.devicebridge.runtime.tools.ToolContext;
import io.github.drompincen.devicebridge.runtime.tools.ToolRegistry;
import io.github.drompincen.devicebridge.runtime.tools.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ShellToolTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ShellExecutor executor = mock(ShellExecutor.class);
    private final ToolContext ctx = new ToolContext("s1", new ScreenStateHolder(), AgentRunListener.NONE);
    private ShellTool tool;

    @BeforeEach
    void setUp() {
        tool = new ShellTool();
        tool.setShellExecutor(executor);
    }

    @Test
    void nameAndSchema() {
        assertThat(tool.name()).isEqualTo("shell");
        assertThat(tool.inputSchema().path("required").get(0).asText()).isEqualTo("command");
    }

    @Test
    void registryBindsTheDeviceShell() throws Exception {
        ShellTool unbound = new ShellTool();
        when(executor.execute("hostname")).thenReturn(new ShellResult("box\n", "", 0));

        new ToolRegistry(new ToolBindings(executor, null, null)).register(unbound);

        assertThat(unbound.execute(ctx, mapper.createObjectNode().put("command", "hostname")).success()).isTrue();
    }

    @Test
    void returnsOutputAndExitCodeAsJson() throws Exception {
        when(executor.execute("Get-Date")).thenReturn(new ShellResult("Monday\n", "", 0));

        ToolResult result = tool.execute(ctx, mapper.createObjectNode().put("command", "Get-Date"));

        assertThat(result.success()).isTrue();
        JsonNode json = mapper.readTree(result.output());
        assertThat(json.path("stdout").asText()).isEqualTo("Monday\n");
        assertThat(json.path("stderr").asText()).isEmpty();
        assertThat(json.path("exitCode").asInt()).isZero();
    }

    @Test
    void nonZeroExitIsStillAToolSuccess() throws Exception {
        when(executor.execute("exit 3")).thenReturn(new ShellResult("", "boom\n", 3));

        ToolResult result = tool.execute(ctx, mapper.createObjectNode().put("command", "exit 3"));

        assertThat(result.success()).isTrue();
        assertThat(mapper.readTree(result.output()).path("exitCode").asInt()).isEqualTo(3);
    }

    @Test
    void launchFailureBecomesToolError() throws Exception {
        when(executor.execute("x")).thenThrow(new IOException("powershell.exe not found"));

        ToolResult result = tool.execute(ctx, mapper.createObjectNode().put("command", "x"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Shell exec failed: powershell.exe not found");
    }

    @Test
    void missingCommandIsRejected() {
        ToolResult result = tool.execute(ctx, mapper.createObjectNode());

        assertThat(result.error()).isEqualTo("command is required");
    }
}
