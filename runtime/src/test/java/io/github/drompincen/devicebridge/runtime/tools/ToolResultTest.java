package io.github.drompincen.devicebridge.runtime.tools;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToolResultTest {

    @Test
    void successTextIsOutput() {
        assertThat(ToolResult.success("done").modelText()).isEqualTo("done");
    }

    @Test
    void failureWithoutOutputIsPrefixed() {
        assertThat(ToolResult.failure("boom").modelText()).isEqualTo("Error: boom");
    }

    @Test
    void failureWithFormattedOutputKeepsIt() {
        ToolResult result = ToolResult.failure("Action: click | Success: false\nError: boom", "boom");

        assertThat(result.success()).isFalse();
        assertThat(result.modelText()).startsWith("Action: click");
    }
}
