package io.github.drompincen.devicebridge.runtime.agent;

public record AgentRunResult(String text, Outcome outcome, int modelCalls) {

    public enum Outcome {
        /** The model stopped calling tools on its own. */
        COMPLETED,
        /** The step budget ran out and the text comes from the summary call. */
        SUMMARIZED,
        /** Stopped by the abort signal; text is whatever had been produced. */
        ABORTED
    }

    public boolean isPartial() {
        return outcome == Outcome.ABORTED;
    }
}
