package io.github.drompincen.devicebridge.gateway.hub;

import io.github.drompincen.devicebridge.gateway.config.HubProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

import java.util.concurrent.ScheduledFuture;

/** Pings every live device so idle connections are not dropped by proxies, and retires idle hubs. */
@Service
public class HeartbeatService {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatService.class);

    private final DeviceHubRegistry registry;
    private final ThreadPoolTaskScheduler scheduler;
    private final HubProperties properties;
    private ScheduledFuture<?> task;

    public HeartbeatService(DeviceHubRegistry registry, ThreadPoolTaskScheduler scheduler, HubProperties properties) {
        this.registry = registry;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    @PostConstruct
    public void start() {
        task = scheduler.scheduleWithFixedDelay(this::beat, properties.getHeartbeatInterval());
        log.info("[hub] heartbeat every {}s", properties.getHeartbeatInterval().toSeconds());
    }

    @PreDestroy
    public void stop() {
        if (task != null) task.cancel(false);
    }

    void beat() {
        registry.evictIdle();
        for (String userId : registry.userIds()) {
            registry.withExistingHub(userId, DeviceHub::pingDevices).ifPresent(ping -> ping.whenComplete((sent, error) -> {
                if (error != null) {
                    log.warn("[hub] heartbeat for {} failed: {}", userId, error.getMessage());
                } else if (sent > 0) {
                    log.debug("[hub] pinged {} device(s) of {}", sent, userId);
                }
            }));
        }
    }
}
