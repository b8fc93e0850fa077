package io.github.drompincen.devicebridge.device.agent;

import io.github.drompincen.devicebridge.device.config.DeviceProperties;
import io.github.drompincen.devicebridge.runtime.agent.AbortSignal;
import io.github.drompincen.devicebridge.runtime.agent.AgentLoop;
import io.github.drompincen.devicebridge.runtime.agent.AgentLoopFactory;
import io.github.drompincen.devicebridge.runtime.agent.AgentRunListener;
import io.github.drompincen.devicebridge.runtime.agent.AgentRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * The device's single agent session. Conversation history carries over between tasks until
 * {@link #reset()} is called.
 */
@Service
public class DeviceAgentService {

    private static final Logger log = LoggerFactory.getLogger(DeviceAgentService.class);

    static final String FAILURE_PREFIX = "[Error] Local agent failed: ";

    private final AgentLoop loop;
    private final String deviceName;

    public DeviceAgentService(AgentLoopFactory factory, DeviceProperties properties) {
        this.deviceName = resolveDeviceName(properties.getDeviceName());
        this.loop = factory.create(deviceName);
    }

    public String getDeviceName() {
        return deviceName;
    }

    /** Runs one task to completion. Never throws; failures come back as an error text. */
    public synchronized String runTask(String task, AgentRunListener listener, AbortSignal abort) {
        log.info("[device] running task: {}", AgentLoop.truncate(task, 100));
        try {
            AgentRunResult result = loop.run(task, listener, abort);
            log.info("[device] task finished ({}, {} model call(s))", result.outcome(), result.modelCalls());
            return result.text();
        } catch (RuntimeException e) {
            log.error("[device] task failed: {}", e.getMessage(), e);
            return FAILURE_PREFIX + e.getMessage();
        }
    }

    public synchronized void reset() {
        loop.reset();
    }

    static String resolveDeviceName(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("[device] cannot resolve host name, using 'device': {}", e.getMessage());
            return "device";
        }
    }
}
