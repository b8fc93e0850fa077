package io.github.drompincen.devicebridge.protocol.api;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TaskOutcomeTest {

    @Test
    void responseIsNotAnError() {
        TaskOutcome outcome = TaskOutcome.response("done");

        assertThat(outcome.isError()).isFalse();
        assertThat(outcome.response()).isEqualTo("done");
    }

    @Test
    void notConnectedNamesTheDevice() {
        TaskOutcome outcome = TaskOutcome.notConnected("deviceA");

        assertThat(outcome.error()).isEqualTo(BridgeError.NOT_CONNECTED);
        assertThat(outcome.errorMessage()).isEqualTo("Device \"deviceA\" is not connected.");
    }

    @Test
    void timeoutNamesTheDuration() {
        TaskOutcome outcome = TaskOutcome.timeout("deviceA", Duration.ofSeconds(120));

        assertThat(outcome.error()).isEqualTo(BridgeError.TIMEOUT);
        assertThat(outcome.errorMessage()).isEqualTo("Device \"deviceA\" did not respond within 120s.");
    }

    @Test
    void fractionalTimeoutIsNotTruncated() {
        assertThat(TaskOutcome.timeout("d", Duration.ofMillis(1500)).errorMessage()).endsWith("within 1.5s.");
        assertThat(TaskOutcome.timeout("d", Duration.ofMillis(250)).errorMessage()).endsWith("within 0.25s.");
    }

    @Test
    void disconnectedIsAnError() {
        assertThat(TaskOutcome.disconnected("deviceA").isError()).isTrue();
    }
}
