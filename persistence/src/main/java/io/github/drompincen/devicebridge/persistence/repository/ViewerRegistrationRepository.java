package io.github.drompincen.devicebridge.persistence.repository;

import io.github.drompincen.devicebridge.persistence.document.ViewerRegistrationDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ViewerRegistrationRepository extends MongoRepository<ViewerRegistrationDocument, String> {
    List<ViewerRegistrationDocument> findByUserId(String userId);
}
