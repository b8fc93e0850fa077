package io.github.drompincen.devicebridge.persistence.document;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ViewerRegistrationDocumentTest {

    @Test
    void viewerFieldsPreserved() {
        ViewerRegistrationDocument doc = new ViewerRegistrationDocument();
        Instant now = Instant.now();
        doc.setConnectionId("v1");
        doc.setUserId("alice");
        doc.setSubscribedAt(now);

        assertThat(doc.getConnectionId()).isEqualTo("v1");
        assertThat(doc.getUserId()).isEqualTo("alice");
        assertThat(doc.getSubscribedAt()).isEqualTo(now);
    }
}
