package io.github.drompincen.vigil.persistence.repository;

import io.github.drompincen.vigil.persistence.document.AutomationScheduleDocument;
import io.github.drompincen.vigil.protocol.api.ScheduleType;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface AutomationScheduleRepository extends MongoRepository<AutomationScheduleDocument, String> {
    List<AutomationScheduleDocument> findByActiveTrueAndScheduleTypeNot(ScheduleType scheduleType);
    List<AutomationScheduleDocument> findByTenantId(String tenantId);
    List<AutomationScheduleDocument> findByTenantIdAndActive(String tenantId, boolean active);
    List<AutomationScheduleDocument> findByTenantIdAndJobType(String tenantId, String jobType);
    List<AutomationScheduleDocument> findByTenantIdAndActiveAndJobType(String tenantId, boolean active, String jobType);
    Optional<AutomationScheduleDocument> findByScheduleIdAndTenantId(String scheduleId, String tenantId);
}
