package io.github.drompincen.devicebridge.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "viewer_registrations")
public class ViewerRegistrationDocument {

    @Id
    private String connectionId;
    @Indexed
    private String userId;
    private Instant subscribedAt;

    public ViewerRegistrationDocument() {}

    public ViewerRegistrationDocument(String connectionId, String userId, Instant subscribedAt) {
        this.connectionId = connectionId;
        this.userId = userId;
        this.subscribedAt = subscribedAt;
    }

    public String getConnectionId() { return connectionId; }
    public void setConnectionId(String connectionId) { this.connectionId = connectionId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public Instant getSubscribedAt() { return subscribedAt; }
    public void setSubscribedAt(Instant subscribedAt) { this.subscribedAt = subscribedAt; }
}
