package io.github.drompincen.devicebridge.gateway.hub;

import io.github.drompincen.devicebridge.persistence.document.DeviceRegistrationDocument;
import io.github.drompincen.devicebridge.persistence.document.ViewerRegistrationDocument;
import io.github.drompincen.devicebridge.persistence.repository.DeviceRegistrationRepository;
import io.github.drompincen.devicebridge.persistence.repository.ViewerRegistrationRepository;
import io.github.drompincen.devicebridge.protocol.api.DeviceDto;
import io.github.drompincen.devicebridge.protocol.api.TaskOutcome;
import io.github.drompincen.devicebridge.protocol.ws.BridgeCodec;
import io.github.drompincen.devicebridge.protocol.ws.BridgeMessage;
import io.github.drompincen.devicebridge.protocol.ws.DeviceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Device and viewer registry plus task correlation for one user.
 *
 * <p>Every operation runs on the hub's single mailbox thread, including task timeouts, so no
 * two mutations for the same user interleave and the in-memory maps need no locking. Callers
 * get a {@link CompletableFuture} for the result. Registrations are persisted; live
 * connections and pending requests exist only in memory.
 */
public class DeviceHub {

    private static final Logger log = LoggerFactory.getLogger(DeviceHub.class);

    static final String SYSTEM_SENDER = "system";
    static final int TASK_PREVIEW_CHARS = 100;

    private final String userId;
    private final DeviceRegistrationRepository deviceRepository;
    private final ViewerRegistrationRepository viewerRepository;
    private final BridgeCodec codec;
    private final Duration taskTimeout;
    private final Clock clock;
    private final ScheduledExecutorService mailbox;

    private final Map<String, HubConnection> connections = new HashMap<>();
    private final Map<String, PendingRequest> pending = new HashMap<>();

    private record PendingRequest(
            String messageId,
            String connectionId,
            String deviceName,
            CompletableFuture<TaskOutcome> caller,
            ScheduledFuture<?> timer
    ) {}

    public DeviceHub(String userId, DeviceRegistrationRepository deviceRepository,
                     ViewerRegistrationRepository viewerRepository, BridgeCodec codec,
                     Duration taskTimeout, Clock clock) {
        this.userId = userId;
        this.deviceRepository = deviceRepository;
        this.viewerRepository = viewerRepository;
        this.codec = codec;
        this.taskTimeout = taskTimeout;
        this.clock = clock;
        this.mailbox = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "hub-" + userId);
            t.setDaemon(true);
            return t;
        });
    }

    public String getUserId() { return userId; }

    /** Makes a freshly opened connection known as live. It has no role until it registers or subscribes. */
    public CompletableFuture<Void> connect(HubConnection connection) {
        return run(() -> {
            connections.put(connection.id(), connection);
            log.debug("[hub] {} connection {} opened", userId, connection.id());
        });
    }

    public CompletableFuture<Void> register(String connectionId, String deviceName) {
        return run(() -> {
            deviceRepository.save(new DeviceRegistrationDocument(connectionId, userId, deviceName, clock.instant()));
            log.info("[hub] {} device '{}' registered on {}", userId, deviceName, connectionId);
            sendTo(connectionId, BridgeMessage.registered(deviceName));
            broadcastDevices();
        });
    }

    public CompletableFuture<Void> subscribe(String connectionId) {
        return run(() -> {
            viewerRepository.save(new ViewerRegistrationDocument(connectionId, userId, clock.instant()));
            log.debug("[hub] {} viewer subscribed on {}", userId, connectionId);
            sendTo(connectionId, BridgeMessage.devices(deviceStatuses(activeDevices())));
        });
    }

    public CompletableFuture<Void> relayLog(String connectionId, String message) {
        return run(() -> {
            String deviceName = deviceRepository.findById(connectionId)
                    .map(DeviceRegistrationDocument::getDeviceName)
                    .orElse("unknown");
            broadcastToViewers(BridgeMessage.deviceLog(deviceName, clock.instant(), message));
        });
    }

    public CompletableFuture<List<DeviceDto>> listActiveDevices() {
        return call(() -> activeDevices().stream()
                .map(d -> new DeviceDto(d.getDeviceName()))
                .toList());
    }

    public CompletableFuture<List<String>> listActiveViewers() {
        return call(() -> activeViewers().stream()
                .map(ViewerRegistrationDocument::getConnectionId)
                .toList());
    }

    /**
     * Routes a task to the named device. Resolves with the device's response, or with a
     * not-connected, timeout or disconnected outcome. Never completes exceptionally for those.
     */
    public CompletableFuture<TaskOutcome> sendTask(String deviceName, String content) {
        CompletableFuture<TaskOutcome> caller = new CompletableFuture<>();
        CompletableFuture<Void> accepted = run(() -> {
            Optional<DeviceRegistrationDocument> target = findActiveDevice(deviceName);
            if (target.isEmpty()) {
                log.info("[hub] {} task for '{}' rejected: not connected", userId, deviceName);
                caller.complete(TaskOutcome.notConnected(deviceName));
                return;
            }
            String connectionId = target.get().getConnectionId();
            String messageId = UUID.randomUUID().toString();
            ScheduledFuture<?> timer = mailbox.schedule(() -> expire(messageId),
                    taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
            pending.put(messageId, new PendingRequest(messageId, connectionId, deviceName, caller, timer));

            if (!sendTo(connectionId, BridgeMessage.task(messageId, content))) {
                PendingRequest request = pending.remove(messageId);
                request.timer().cancel(false);
                caller.complete(TaskOutcome.disconnected(deviceName));
                return;
            }
            log.info("[hub] {} task {} sent to '{}'", userId, messageId, deviceName);
            broadcastToViewers(BridgeMessage.deviceLog(deviceName, clock.instant(),
                    "Received task: " + preview(content)));
        });
        accepted.whenComplete((ignored, error) -> {
            if (error != null) caller.completeExceptionally(error);
        });
        return caller;
    }

    public CompletableFuture<Void> onResponse(String messageId, String content) {
        return run(() -> {
            PendingRequest request = pending.remove(messageId);
            if (request == null) {
                log.debug("[hub] {} ignoring response for unknown message {}", userId, messageId);
                return;
            }
            request.timer().cancel(false);
            request.caller().complete(TaskOutcome.response(content));
            log.info("[hub] {} task {} answered by '{}' ({} chars)", userId, messageId,
                    request.deviceName(), content.length());
            broadcastToViewers(BridgeMessage.deviceLog(SYSTEM_SENDER, clock.instant(),
                    "Task response received (" + content.length() + " chars)"));
        });
    }

    public CompletableFuture<Void> onDisconnect(String connectionId) {
        return run(() -> {
            connections.remove(connectionId);
            Optional<DeviceRegistrationDocument> device = deviceRepository.findById(connectionId);
            device.ifPresent(d -> deviceRepository.deleteById(connectionId));
            viewerRepository.deleteById(connectionId);

            int failed = 0;
            for (Iterator<PendingRequest> it = pending.values().iterator(); it.hasNext(); ) {
                PendingRequest request = it.next();
                if (request.connectionId().equals(connectionId)) {
                    it.remove();
                    request.timer().cancel(false);
                    request.caller().complete(TaskOutcome.disconnected(request.deviceName()));
                    failed++;
                }
            }
            if (device.isPresent()) {
                log.info("[hub] {} device '{}' disconnected, {} pending task(s) failed",
                        userId, device.get().getDeviceName(), failed);
                broadcastDevices();
            } else {
                log.debug("[hub] {} connection {} closed", userId, connectionId);
            }
        });
    }

    /** Sends a heartbeat to every live device. */
    public CompletableFuture<Integer> pingDevices() {
        return call(() -> {
            int sent = 0;
            for (DeviceRegistrationDocument device : activeDevices()) {
                if (sendTo(device.getConnectionId(), BridgeMessage.ping())) sent++;
            }
            return sent;
        });
    }

    /** Asks the named device to clear its agent state. Completes with false when it is not connected. */
    public CompletableFuture<Boolean> resetDevice(String deviceName) {
        return call(() -> {
            Optional<DeviceRegistrationDocument> target = findActiveDevice(deviceName);
            if (target.isEmpty()) return false;
            log.info("[hub] {} reset requested for '{}'", userId, deviceName);
            return sendTo(target.get().getConnectionId(), BridgeMessage.reset());
        });
    }

    /** True once the hub holds no open connection and no request awaiting an answer. */
    public CompletableFuture<Boolean> isIdle() {
        return call(() -> connections.isEmpty() && pending.isEmpty());
    }

    int pendingCount() {
        return pending.size();
    }

    /** Fails outstanding callers and stops the mailbox. */
    public void shutdown() {
        CompletableFuture<Void> drained = run(() -> {
            pending.values().forEach(r -> {
                r.timer().cancel(false);
                r.caller().complete(TaskOutcome.disconnected(r.deviceName()));
            });
            pending.clear();
        });
        drained.whenComplete((ignored, error) -> mailbox.shutdown());
    }

    private void expire(String messageId) {
        PendingRequest request = pending.remove(messageId);
        if (request == null) return;
        log.warn("[hub] {} task {} to '{}' timed out after {}", userId, messageId,
                request.deviceName(), taskTimeout);
        request.caller().complete(TaskOutcome.timeout(request.deviceName(), taskTimeout));
    }

    /** Persisted device rows whose connection is live. Stale rows are deleted on the way. */
    private List<DeviceRegistrationDocument> activeDevices() {
        List<DeviceRegistrationDocument> active = new ArrayList<>();
        for (DeviceRegistrationDocument row : deviceRepository.findByUserId(userId)) {
            if (isLive(row.getConnectionId())) {
                active.add(row);
            } else {
                log.debug("[hub] {} removing stale device row '{}' ({})", userId, row.getDeviceName(), row.getConnectionId());
                deviceRepository.deleteById(row.getConnectionId());
            }
        }
        return active;
    }

    private List<ViewerRegistrationDocument> activeViewers() {
        List<ViewerRegistrationDocument> active = new ArrayList<>();
        for (ViewerRegistrationDocument row : viewerRepository.findByUserId(userId)) {
            if (isLive(row.getConnectionId())) {
                active.add(row);
            } else {
                viewerRepository.deleteById(row.getConnectionId());
            }
        }
        return active;
    }

    /** The most recent live registration under that name. */
    private Optional<DeviceRegistrationDocument> findActiveDevice(String deviceName) {
        return activeDevices().stream()
                .filter(d -> deviceName.equals(d.getDeviceName()))
                .max(Comparator.comparing(DeviceRegistrationDocument::getRegisteredAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())));
    }

    private boolean isLive(String connectionId) {
        HubConnection connection = connections.get(connectionId);
        return connection != null && connection.isOpen();
    }

    private void broadcastDevices() {
        broadcastToViewers(BridgeMessage.devices(deviceStatuses(activeDevices())));
    }

    private static List<DeviceStatus> deviceStatuses(List<DeviceRegistrationDocument> devices) {
        return devices.stream().map(d -> DeviceStatus.connected(d.getDeviceName())).toList();
    }

    private void broadcastToViewers(BridgeMessage message) {
        String frame = codec.encode(message);
        for (ViewerRegistrationDocument viewer : activeViewers()) {
            sendFrame(viewer.getConnectionId(), frame);
        }
    }

    private boolean sendTo(String connectionId, BridgeMessage message) {
        return sendFrame(connectionId, codec.encode(message));
    }

    private boolean sendFrame(String connectionId, String frame) {
        HubConnection connection = connections.get(connectionId);
        if (connection == null || !connection.isOpen()) {
            return false;
        }
        try {
            connection.send(frame);
            return true;
        } catch (IOException e) {
            log.warn("[hub] {} send to {} failed: {}", userId, connectionId, e.getMessage());
            return false;
        }
    }

    private CompletableFuture<Void> run(Runnable action) {
        return call(() -> {
            action.run();
            return null;
        });
    }

    private <T> CompletableFuture<T> call(Callable<T> action) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            mailbox.execute(() -> {
                try {
                    result.complete(action.call());
                } catch (Exception e) {
                    log.error("[hub] {} operation failed: {}", userId, e.getMessage(), e);
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new IllegalStateException("Hub for " + userId + " is shut down", e));
        }
        return result;
    }

    private static String preview(String content) {
        return content.length() <= TASK_PREVIEW_CHARS ? content : content.substring(0, TASK_PREVIEW_CHARS) + "...";
    }
}
