package io.github.drompincen.vigil.persistence.repository;

import io.github.drompincen.vigil.persistence.document.SchedulerEventDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface SchedulerEventRepository extends MongoRepository<SchedulerEventDocument, String> {
    List<SchedulerEventDocument> findByTenantIdOrderByTimestampDesc(String tenantId, Pageable pageable);
    List<SchedulerEventDocument> findAllByOrderByTimestampDesc(Pageable pageable);
}
