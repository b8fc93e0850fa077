package io.github.drompincen.devicebridge.runtime.agent;

/** Progress callbacks of one run. All methods are optional. */
public interface AgentRunListener {

    AgentRunListener NONE = new AgentRunListener() {};

    default void onLog(String line) {}

    default void onScreenshot(int step, String action, String base64Png) {}

    default void onTree(int step, String action, String tree) {}
}
