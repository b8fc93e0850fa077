package io.github.drompincen.devicebridge.gateway.controller;

import io.github.drompincen.devicebridge.gateway.hub.DeviceHub;
import io.github.drompincen.devicebridge.gateway.hub.DeviceHubRegistry;
import io.github.drompincen.devicebridge.gateway.websocket.BridgeWebSocketHandler;
import io.github.drompincen.devicebridge.protocol.api.DeviceDto;
import io.github.drompincen.devicebridge.protocol.api.SendTaskRequest;
import io.github.drompincen.devicebridge.protocol.api.TaskOutcome;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/** Control surface for the orchestrator. Task calls hold the request open until the hub resolves them. */
@RestController
@RequestMapping("/api/bridge")
public class BridgeController {

    private final DeviceHubRegistry registry;

    public BridgeController(DeviceHubRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/devices")
    public CompletableFuture<List<DeviceDto>> devices(
            @RequestHeader(value = BridgeWebSocketHandler.USER_HEADER, required = false) String userId) {
        return registry.withHub(user(userId), DeviceHub::listActiveDevices);
    }

    @PostMapping("/message")
    public CompletableFuture<ResponseEntity<Map<String, String>>> message(
            @RequestHeader(value = BridgeWebSocketHandler.USER_HEADER, required = false) String userId,
            @RequestBody SendTaskRequest request) {
        if (request == null || isBlank(request.deviceName()) || isBlank(request.content())) {
            return CompletableFuture.completedFuture(
                    ResponseEntity.badRequest().body(Map.of("error", "deviceName and content are required")));
        }
        return registry.withHub(user(userId), hub -> hub.sendTask(request.deviceName().trim(), request.content()))
                .thenApply(BridgeController::toResponse);
    }

    @PostMapping("/devices/{deviceName}/reset")
    public CompletableFuture<ResponseEntity<Map<String, String>>> reset(
            @RequestHeader(value = BridgeWebSocketHandler.USER_HEADER, required = false) String userId,
            @PathVariable String deviceName) {
        return registry.withHub(user(userId), hub -> hub.resetDevice(deviceName)).thenApply(sent -> sent
                ? ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("status", "reset sent"))
                : ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", TaskOutcome.notConnected(deviceName).errorMessage())));
    }

    static ResponseEntity<Map<String, String>> toResponse(TaskOutcome outcome) {
        if (!outcome.isError()) {
            return ResponseEntity.ok(Map.of("response", outcome.response()));
        }
        HttpStatus status = switch (outcome.error()) {
            case NOT_CONNECTED -> HttpStatus.NOT_FOUND;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case DISCONNECTED -> HttpStatus.BAD_GATEWAY;
        };
        return ResponseEntity.status(status).body(Map.of("error", outcome.errorMessage()));
    }

    private static String user(String header) {
        return isBlank(header) ? BridgeWebSocketHandler.DEFAULT_USER : header.trim();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
