package io.github.drompincen.devicebridge.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.devicebridge.runtime.shell.ShellExecutor;
import io.github.drompincen.devicebridge.runtime.shell.ShellResult;
import io.github.drompincen.devicebridge.runtime.tools.Tool;
import io.github.drompincen.devicebridge.runtime.tools.ToolBindings;
import io.github.drompincen.devicebridge.runtime.tools.ToolContext;
import io.github.drompincen.devicebridge.runtime.tools.ToolResult;

import java.io.IOException;

public class ShellTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ShellExecutor shellExecutor;

    public void setShellExecutor(ShellExecutor shellExecutor) {
        this.shellExecutor = shellExecutor;
    }

    @Override
    public void bind(ToolBindings bindings) {
        bindings.shell().ifPresent(this::setShellExecutor);
    }

    @Override public String name() { return "shell"; }

    @Override public String description() {
        return "Run a command in the device's shell (PowerShell on Windows, sh elsewhere). "
                + "Returns stdout, stderr and the exit code as JSON. Use for files, processes, "
                + "launching applications and system queries.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("command").put("type", "string").put("description", "Command to execute");
        schema.putArray("required").add("command");
        return schema;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        String command = input == null ? null : input.path("command").asText(null);
        if (command == null || command.isBlank()) {
            return ToolResult.failure("command is required");
        }
        if (shellExecutor == null) {
            return ToolResult.failure("No shell executor configured");
        }
        try {
            ShellResult result = shellExecutor.execute(command);
            ctx.log("shell: " + abbreviate(command) + " -> exit " + result.exitCode());
            return ToolResult.success(toJson(result));
        } catch (IOException e) {
            return ToolResult.failure("Shell exec failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure("Shell exec interrupted");
        }
    }

    static String toJson(ShellResult result) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("stdout", result.stdout());
        node.put("stderr", result.stderr());
        node.put("exitCode", result.exitCode());
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize shell result", e);
        }
    }

    private static String abbreviate(String command) {
        String oneLine = command.replace('\n', ' ');
        return oneLine.length() <= 80 ? oneLine : oneLine.substring(0, 80) + "...";
    }
}
