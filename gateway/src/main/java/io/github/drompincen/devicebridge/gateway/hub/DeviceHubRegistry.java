package io.github.drompincen.devicebridge.gateway.hub;

import io.github.drompincen.devicebridge.gateway.config.HubProperties;
import io.github.drompincen.devicebridge.persistence.repository.DeviceRegistrationRepository;
import io.github.drompincen.devicebridge.persistence.repository.ViewerRegistrationRepository;
import io.github.drompincen.devicebridge.protocol.ws.BridgeCodec;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * One {@link DeviceHub} per user, created on first use and retired once it goes idle.
 * Work is handed to a hub while its map entry is locked, so a hub is never retired
 * between being looked up and receiving the work.
 */
@Component
public class DeviceHubRegistry {

    private static final Logger log = LoggerFactory.getLogger(DeviceHubRegistry.class);
    private static final long IDLE_CHECK_SECONDS = 2;

    private final DeviceRegistrationRepository deviceRepository;
    private final ViewerRegistrationRepository viewerRepository;
    private final BridgeCodec codec;
    private final HubProperties properties;
    private final Clock clock;
    private final ConcurrentHashMap<String, DeviceHub> hubs = new ConcurrentHashMap<>();

    public DeviceHubRegistry(DeviceRegistrationRepository deviceRepository,
                             ViewerRegistrationRepository viewerRepository,
                             BridgeCodec codec, HubProperties properties, Clock clock) {
        this.deviceRepository = deviceRepository;
        this.viewerRepository = viewerRepository;
        this.codec = codec;
        this.properties = properties;
        this.clock = clock;
    }

    /** Runs {@code work} against the user's hub, starting one if needed. */
    public <T> CompletableFuture<T> withHub(String userId, Function<DeviceHub, CompletableFuture<T>> work) {
        AtomicReference<CompletableFuture<T>> result = new AtomicReference<>();
        hubs.compute(userId, (id, existing) -> {
            DeviceHub hub = existing != null ? existing : start(id);
            result.set(work.apply(hub));
            return hub;
        });
        return result.get();
    }

    /** Runs {@code work} against the user's hub only if one is running. */
    public <T> Optional<CompletableFuture<T>> withExistingHub(String userId,
                                                              Function<DeviceHub, CompletableFuture<T>> work) {
        AtomicReference<CompletableFuture<T>> result = new AtomicReference<>();
        hubs.computeIfPresent(userId, (id, hub) -> {
            result.set(work.apply(hub));
            return hub;
        });
        return Optional.ofNullable(result.get());
    }

    public List<String> userIds() {
        return List.copyOf(hubs.keySet());
    }

    /** Shuts down hubs with no open connection and no pending request. Returns how many were retired. */
    public int evictIdle() {
        int retired = 0;
        for (String userId : userIds()) {
            AtomicBoolean evicted = new AtomicBoolean();
            hubs.computeIfPresent(userId, (id, hub) -> {
                if (!isIdle(hub)) return hub;
                hub.shutdown();
                evicted.set(true);
                return null;
            });
            if (evicted.get()) {
                retired++;
                log.info("[hub] retired idle hub for user {}", userId);
            }
        }
        return retired;
    }

    @PreDestroy
    public void shutdown() {
        for (String userId : userIds()) {
            DeviceHub hub = hubs.remove(userId);
            if (hub != null) hub.shutdown();
        }
    }

    private DeviceHub start(String userId) {
        log.info("[hub] starting hub for user {}", userId);
        return new DeviceHub(userId, deviceRepository, viewerRepository, codec, properties.getTaskTimeout(), clock);
    }

    private static boolean isIdle(DeviceHub hub) {
        try {
            return hub.isIdle().get(IDLE_CHECK_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[hub] idle check for {} failed, keeping it: {}", hub.getUserId(), e.toString());
            return false;
        }
    }
}
