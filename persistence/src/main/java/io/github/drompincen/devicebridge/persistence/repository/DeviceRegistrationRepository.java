package io.github.drompincen.devicebridge.persistence.repository;

import io.github.drompincen.devicebridge.persistence.document.DeviceRegistrationDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface DeviceRegistrationRepository extends MongoRepository<DeviceRegistrationDocument, String> {
    List<DeviceRegistrationDocument> findByUserId(String userId);
}
