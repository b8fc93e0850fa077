package io.github.drompincen.devicebridge.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "device_registrations")
@CompoundIndex(name = "user_device", def = "{'userId': 1, 'deviceName': 1}")
public class DeviceRegistrationDocument {

    @Id
    private String connectionId;
    private String userId;
    private String deviceName;
    private Instant registeredAt;

    public DeviceRegistrationDocument() {}

    public DeviceRegistrationDocument(String connectionId, String userId, String deviceName, Instant registeredAt) {
        this.connectionId = connectionId;
        this.userId = userId;
        this.deviceName = deviceName;
        this.registeredAt = registeredAt;
    }

    public String getConnectionId() { return connectionId; }
    public void setConnectionId(String connectionId) { this.connectionId = connectionId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getDeviceName() { return deviceName; }
    public void setDeviceName(String deviceName) { this.deviceName = deviceName; }

    public Instant getRegisteredAt() { return registeredAt; }
    public void setRegisteredAt(Instant registeredAt) { this.registeredAt = registeredAt; }
}
