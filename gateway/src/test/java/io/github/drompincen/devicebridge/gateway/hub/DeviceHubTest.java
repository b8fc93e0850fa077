package io.github.drompincen.devicebridge.gateway.hub;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.devicebridge.persistence.document.DeviceRegistrationDocument;
import io.github.drompincen.devicebridge.persistence.document.ViewerRegistrationDocument;
import io.github.drompincen.devicebridge.persistence.repository.DeviceRegistrationRepository;
import io.github.drompincen.devicebridge.persistence.repository.ViewerRegistrationRepository;
import io.github.drompincen.devicebridge.protocol.api.BridgeError;
import io.github.drompincen.devicebridge.protocol.api.DeviceDto;
import io.github.drompincen.devicebridge.protocol.api.TaskOutcome;
import io.github.drompincen.devicebridge.protocol.ws.BridgeCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DeviceHubTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String USER = "alice";

    @Mock private DeviceRegistrationRepository deviceRepository;
    @Mock private ViewerRegistrationRepository viewerRepository;

    private final Map<String, DeviceRegistrationDocument> deviceRows = new ConcurrentHashMap<>();
    private final Map<String, ViewerRegistrationDocument> viewerRows = new ConcurrentHashMap<>();
    private DeviceHub hub;

    @BeforeEach
    void setUp() {
        when(deviceRepository.save(any())).thenAnswer(inv -> {
            DeviceRegistrationDocument doc = inv.getArgument(0);
            deviceRows.put(doc.getConnectionId(), doc);
            return doc;
        });
        when(deviceRepository.findByUserId(anyString())).thenAnswer(inv -> deviceRows.values().stream()
                .filter(d -> d.getUserId().equals(inv.getArgument(0))).toList());
        when(deviceRepository.findById(anyString())).thenAnswer(inv -> Optional.ofNullable(deviceRows.get(inv.<String>getArgument(0))));
        doAnswer(inv -> deviceRows.remove(inv.<String>getArgument(0))).when(deviceRepository).deleteById(anyString());

        when(viewerRepository.save(any())).thenAnswer(inv -> {
            ViewerRegistrationDocument doc = inv.getArgument(0);
            viewerRows.put(doc.getConnectionId(), doc);
            return doc;
        });
        when(viewerRepository.findByUserId(anyString())).thenAnswer(inv -> viewerRows.values().stream()
                .filter(v -> v.getUserId().equals(inv.getArgument(0))).toList());
        doAnswer(inv -> viewerRows.remove(inv.<String>getArgument(0))).when(viewerRepository).deleteById(anyString());

        hub = newHub(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        hub.shutdown();
    }

    private DeviceHub newHub(Duration timeout) {
        return new DeviceHub(USER, deviceRepository, viewerRepository, new BridgeCodec(), timeout,
                Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    private FakeConnection device(String connId, String name) throws Exception {
        FakeConnection conn = new FakeConnection(connId);
        hub.connect(conn).get(1, TimeUnit.SECONDS);
        hub.register(connId, name).get(1, TimeUnit.SECONDS);
        return conn;
    }

    private FakeConnection viewer(String connId) throws Exception {
        FakeConnection conn = new FakeConnection(connId);
        hub.connect(conn).get(1, TimeUnit.SECONDS);
        hub.subscribe(connId).get(1, TimeUnit.SECONDS);
        return conn;
    }

    @Test
    void registerPersistsAcknowledgesAndBroadcasts() throws Exception {
        FakeConnection viewer = viewer("v1");
        FakeConnection laptop = device("c1", "laptop");

        assertThat(deviceRows).containsKey("c1");
        assertThat(deviceRows.get("c1").getUserId()).isEqualTo(USER);
        assertThat(json(laptop.sent.get(0)).path("type").asText()).isEqualTo("registered");
        JsonNode broadcast = json(viewer.sent.get(viewer.sent.size() - 1));
        assertThat(broadcast.path("type").asText()).isEqualTo("devices");
        assertThat(broadcast.path("devices").get(0).path("deviceName").asText()).isEqualTo("laptop");
        assertThat(broadcast.path("devices").get(0).path("status").asText()).isEqualTo("connected");
    }

    @Test
    void subscribePushesCurrentDeviceList() throws Exception {
        device("c1", "laptop");

        FakeConnection viewer = viewer("v1");

        assertThat(viewer.sent).hasSize(1);
        assertThat(json(viewer.sent.get(0)).path("devices")).hasSize(1);
    }

    @Test
    void listActiveDevicesDeletesRowsWithoutLiveConnection() throws Exception {
        device("c1", "laptop");
        deviceRows.put("gone", new DeviceRegistrationDocument("gone", USER, "phone", Instant.EPOCH));

        List<DeviceDto> devices = hub.listActiveDevices().get(1, TimeUnit.SECONDS);

        assertThat(devices).containsExactly(new DeviceDto("laptop"));
        assertThat(deviceRows).doesNotContainKey("gone");
    }

    @Test
    void closedConnectionIsNotActive() throws Exception {
        FakeConnection laptop = device("c1", "laptop");
        laptop.close();

        assertThat(hub.listActiveDevices().get(1, TimeUnit.SECONDS)).isEmpty();
        assertThat(deviceRows).isEmpty();
    }

    @Test
    void listActiveViewersReconcilesToo() throws Exception {
        viewer("v1");
        viewerRows.put("old", new ViewerRegistrationDocument("old", USER, Instant.EPOCH));

        assertThat(hub.listActiveViewers().get(1, TimeUnit.SECONDS)).containsExactly("v1");
        assertThat(viewerRows).doesNotContainKey("old");
    }

    @Test
    void sendTaskToUnknownDeviceFailsWithoutSending() throws Exception {
        FakeConnection laptop = device("c1", "laptop");
        int before = laptop.sent.size();

        TaskOutcome outcome = hub.sendTask("deviceA", "open settings").get(1, TimeUnit.SECONDS);

        assertThat(outcome.error()).isEqualTo(BridgeError.NOT_CONNECTED);
        assertThat(outcome.errorMessage()).isEqualTo("Device \"deviceA\" is not connected.");
        assertThat(laptop.sent).hasSize(before);
        assertThat(hub.pendingCount()).isZero();
    }

    @Test
    void responseResolvesTheWaitingCaller() throws Exception {
        FakeConnection laptop = device("c1", "laptop");
        FakeConnection viewer = viewer("v1");

        CompletableFuture<TaskOutcome> caller = hub.sendTask("laptop", "open settings");
        JsonNode task = awaitFrame(laptop, "task");
        assertThat(task.path("content").asText()).isEqualTo("open settings");

        hub.onResponse(task.path("messageId").asText(), "Settings opened").get(1, TimeUnit.SECONDS);

        assertThat(caller.get(1, TimeUnit.SECONDS)).isEqualTo(TaskOutcome.response("Settings opened"));
        assertThat(hub.pendingCount()).isZero();
        List<String> logs = new ArrayList<>();
        for (String frame : viewer.sent) {
            JsonNode node = json(frame);
            if (node.path("type").asText().equals("device_log")) {
                logs.add(node.path("deviceName").asText() + ": " + node.path("message").asText());
            }
        }
        assertThat(logs).containsExactly(
                "laptop: Received task: open settings",
                "system: Task response received (15 chars)");
    }

    @Test
    void duplicateResponseIsIgnored() throws Exception {
        FakeConnection laptop = device("c1", "laptop");
        CompletableFuture<TaskOutcome> caller = hub.sendTask("laptop", "task");
        String messageId = awaitFrame(laptop, "task").path("messageId").asText();

        hub.onResponse(messageId, "first").get(1, TimeUnit.SECONDS);
        hub.onResponse(messageId, "second").get(1, TimeUnit.SECONDS);
        hub.onResponse("unknown-id", "stray").get(1, TimeUnit.SECONDS);

        assertThat(caller.get(1, TimeUnit.SECONDS).response()).isEqualTo("first");
    }

    @Test
    void unansweredTaskTimesOutWithConfiguredDuration() throws Exception {
        hub.shutdown();
        hub = newHub(Duration.ofMillis(1500));
        device("c1", "laptop");

        TaskOutcome outcome = hub.sendTask("laptop", "slow").get(5, TimeUnit.SECONDS);

        assertThat(outcome.error()).isEqualTo(BridgeError.TIMEOUT);
        assertThat(outcome.errorMessage()).isEqualTo("Device \"laptop\" did not respond within 1.5s.");
        assertThat(hub.pendingCount()).isZero();
    }

    @Test
    void subSecondTimeoutIsNamedExactly() throws Exception {
        hub.shutdown();
        hub = newHub(Duration.ofMillis(500));
        device("c1", "laptop");

        TaskOutcome outcome = hub.sendTask("laptop", "slow").get(5, TimeUnit.SECONDS);

        assertThat(outcome.errorMessage()).isEqualTo("Device \"laptop\" did not respond within 0.5s.");
    }

    @Test
    void disconnectFailsOnlyThatDevicesPendingRequests() throws Exception {
        FakeConnection laptop = device("c1", "laptop");
        FakeConnection phone = device("c2", "phone");
        CompletableFuture<TaskOutcome> first = hub.sendTask("laptop", "one");
        CompletableFuture<TaskOutcome> second = hub.sendTask("laptop", "two");
        CompletableFuture<TaskOutcome> other = hub.sendTask("phone", "three");
        awaitFrame(phone, "task");

        laptop.close();
        hub.onDisconnect("c1").get(1, TimeUnit.SECONDS);

        assertThat(first.isDone()).isTrue();
        assertThat(second.isDone()).isTrue();
        assertThat(first.get().error()).isEqualTo(BridgeError.DISCONNECTED);
        assertThat(second.get().errorMessage()).isEqualTo("Device \"laptop\" disconnected before responding.");
        assertThat(other.isDone()).isFalse();
        assertThat(hub.pendingCount()).isEqualTo(1);
        assertThat(deviceRows).containsOnlyKeys("c2");
    }

    @Test
    void idleOnlyWithoutConnectionsOrPendingTasks() throws Exception {
        assertThat(hub.isIdle().get(1, TimeUnit.SECONDS)).isTrue();

        FakeConnection laptop = device("c1", "laptop");
        CompletableFuture<TaskOutcome> task = hub.sendTask("laptop", "one");
        awaitFrame(laptop, "task");
        assertThat(hub.isIdle().get(1, TimeUnit.SECONDS)).isFalse();

        laptop.close();
        hub.onDisconnect("c1").get(1, TimeUnit.SECONDS);

        assertThat(task.get(1, TimeUnit.SECONDS).error()).isEqualTo(BridgeError.DISCONNECTED);
        assertThat(hub.isIdle().get(1, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void failedSendResolvesAsDisconnected() throws Exception {
        FakeConnection laptop = device("c1", "laptop");
        laptop.failSends();

        TaskOutcome outcome = hub.sendTask("laptop", "task").get(1, TimeUnit.SECONDS);

        assertThat(outcome.error()).isEqualTo(BridgeError.DISCONNECTED);
        assertThat(hub.pendingCount()).isZero();
    }

    @Test
    void relayLogAttributesToRegisteredDevice() throws Exception {
        device("c1", "laptop");
        FakeConnection viewer = viewer("v1");

        hub.relayLog("c1", "[agent] step 1...").get(1, TimeUnit.SECONDS);

        JsonNode log = json(viewer.sent.get(viewer.sent.size() - 1));
        assertThat(log.path("type").asText()).isEqualTo("device_log");
        assertThat(log.path("deviceName").asText()).isEqualTo("laptop");
        assertThat(log.path("message").asText()).isEqualTo("[agent] step 1...");
        assertThat(log.path("time").asText()).isEqualTo("2025-03-01T10:00:00Z");
    }

    @Test
    void pingAndResetGoOnlyToLiveDevices() throws Exception {
        FakeConnection laptop = device("c1", "laptop");
        FakeConnection phone = device("c2", "phone");
        phone.close();

        assertThat(hub.pingDevices().get(1, TimeUnit.SECONDS)).isEqualTo(1);
        assertThat(hub.resetDevice("laptop").get(1, TimeUnit.SECONDS)).isTrue();
        assertThat(hub.resetDevice("phone").get(1, TimeUnit.SECONDS)).isFalse();
        assertThat(laptop.sent).extracting(f -> json(f).path("type").asText()).contains("ping", "reset");
    }

    @Test
    void reRegisteredNameRoutesToNewestConnection() throws Exception {
        FakeConnection old = device("c1", "laptop");
        when(deviceRepository.save(any())).thenAnswer(inv -> {
            DeviceRegistrationDocument doc = inv.getArgument(0);
            doc.setRegisteredAt(Instant.parse("2025-03-01T11:00:00Z"));
            deviceRows.put(doc.getConnectionId(), doc);
            return doc;
        });
        FakeConnection fresh = device("c9", "laptop");

        hub.sendTask("laptop", "hello");
        awaitFrame(fresh, "task");

        assertThat(old.sent).extracting(f -> json(f).path("type").asText()).doesNotContain("task");
    }

    private JsonNode awaitFrame(FakeConnection conn, String type) throws Exception {
        long deadline = System.currentTimeMillis() + 2000;
        while (System.currentTimeMillis() < deadline) {
            for (String frame : conn.sent) {
                JsonNode node = json(frame);
                if (node.path("type").asText().equals(type)) return node;
            }
            Thread.sleep(10);
        }
        throw new AssertionError("no '" + type + "' frame sent to " + conn.id());
    }

    private static JsonNode json(String frame) {
        try {
            return MAPPER.readTree(frame);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }
}
