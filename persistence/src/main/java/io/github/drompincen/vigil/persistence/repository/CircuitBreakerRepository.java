package io.github.drompincen.vigil.persistence.repository;

import io.github.drompincen.vigil.persistence.document.CircuitBreakerDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface CircuitBreakerRepository extends MongoRepository<CircuitBreakerDocument, String> {
    List<CircuitBreakerDocument> findByTenantId(String tenantId);
}
