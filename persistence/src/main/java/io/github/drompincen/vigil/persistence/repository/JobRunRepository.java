package io.github.drompincen.vigil.persistence.repository;

import io.github.drompincen.vigil.persistence.document.JobRunDocument;
import io.github.drompincen.vigil.protocol.api.JobRunStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface JobRunRepository extends MongoRepository<JobRunDocument, String> {
    Page<JobRunDocument> findByTenantIdOrderByStartedAtDesc(String tenantId, Pageable pageable);
    Page<JobRunDocument> findByTenantIdAndJobTypeOrderByStartedAtDesc(String tenantId, String jobType, Pageable pageable);
    Page<JobRunDocument> findByTenantIdAndStatusOrderByStartedAtDesc(String tenantId, JobRunStatus status, Pageable pageable);
    Page<JobRunDocument> findAllByOrderByStartedAtDesc(Pageable pageable);
    List<JobRunDocument> findByScheduleIdOrderByStartedAtDesc(String scheduleId);
    List<JobRunDocument> findByStatusIn(List<JobRunStatus> statuses);
    List<JobRunDocument> findByTenantIdAndStatusIn(String tenantId, List<JobRunStatus> statuses);
    List<JobRunDocument> findByTenantId(String tenantId);
}
