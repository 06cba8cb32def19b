package io.github.drompincen.vigil.runtime.job;

import io.github.drompincen.vigil.persistence.document.JobRunDocument;
import io.github.drompincen.vigil.persistence.repository.JobRunRepository;
import io.github.drompincen.vigil.protocol.api.JobRunResponse;
import io.github.drompincen.vigil.protocol.api.JobRunStats;
import io.github.drompincen.vigil.protocol.api.JobRunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class JobRunServiceTest {

    @Mock private JobRunRepository jobRunRepository;

    private JobRunService service;

    @BeforeEach
    void setUp() {
        service = new JobRunService(jobRunRepository);
    }

    @Test
    void list_prefersStatusFilter() {
        when(jobRunRepository.findByTenantIdAndStatusOrderByStartedAtDesc(eq("t1"), eq(JobRunStatus.FAILED), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(makeRun("r1", "client_monitoring", JobRunStatus.FAILED, null))));

        List<JobRunResponse> runs = service.list("t1", "client_monitoring", JobRunStatus.FAILED, 0, 20);

        assertThat(runs).extracting(JobRunResponse::jobRunId).containsExactly("r1");
        verify(jobRunRepository, never()).findByTenantIdAndJobTypeOrderByStartedAtDesc(any(), any(), any());
    }

    @Test
    void list_clampsPageSize() {
        when(jobRunRepository.findByTenantIdOrderByStartedAtDesc(eq("t1"), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of()));

        service.list("t1", null, null, -1, 10_000);

        verify(jobRunRepository).findByTenantIdOrderByStartedAtDesc(eq("t1"),
                argThat(p -> p.getPageNumber() == 0 && p.getPageSize() == 500));
    }

    @Test
    void get_mapsDocument() {
        when(jobRunRepository.findById("r1"))
                .thenReturn(Optional.of(makeRun("r1", "client_monitoring", JobRunStatus.COMPLETED, 1500L)));

        assertThat(service.get("r1")).hasValueSatisfying(r -> {
            assertThat(r.status()).isEqualTo(JobRunStatus.COMPLETED);
            assertThat(r.durationMs()).isEqualTo(1500L);
        });
        assertThat(service.get("missing")).isEmpty();
    }

    @Test
    void active_queriesPendingAndRunning() {
        when(jobRunRepository.findByTenantIdAndStatusIn("t1", List.of(JobRunStatus.PENDING, JobRunStatus.RUNNING)))
                .thenReturn(List.of(makeRun("r1", "client_monitoring", JobRunStatus.RUNNING, null)));

        assertThat(service.active("t1")).hasSize(1);
    }

    @Test
    void stats_countsPerStatusAndTypeAndAveragesCompleted() {
        when(jobRunRepository.findByTenantId("t1")).thenReturn(List.of(
                makeRun("r1", "client_monitoring", JobRunStatus.COMPLETED, 2000L),
                makeRun("r2", "client_monitoring", JobRunStatus.COMPLETED, 4000L),
                makeRun("r3", "client_monitoring", JobRunStatus.FAILED, 100_000L),
                makeRun("r4", "notification_digest", JobRunStatus.RUNNING, null)));

        JobRunStats stats = service.stats("t1");

        assertThat(stats.totalRuns()).isEqualTo(4);
        assertThat(stats.completedRuns()).isEqualTo(2);
        assertThat(stats.failedRuns()).isEqualTo(1);
        assertThat(stats.runningRuns()).isEqualTo(1);
        assertThat(stats.pendingRuns()).isZero();
        assertThat(stats.averageDurationSeconds()).isEqualTo(3.0);
        assertThat(stats.runsByJobType()).containsEntry("client_monitoring", 3L)
                .containsEntry("notification_digest", 1L);
    }

    @Test
    void stats_withoutCompletedRuns_hasNoAverage() {
        when(jobRunRepository.findByTenantId("t1")).thenReturn(List.of());

        assertThat(service.stats("t1").averageDurationSeconds()).isNull();
    }

    private static JobRunDocument makeRun(String id, String jobType, JobRunStatus status, Long durationMs) {
        JobRunDocument doc = new JobRunDocument();
        doc.setJobRunId(id);
        doc.setTenantId("t1");
        doc.setJobType(jobType);
        doc.setStatus(status);
        doc.setStartedAt(Instant.parse("2024-03-01T09:00:00Z"));
        doc.setDurationMs(durationMs);
        return doc;
    }
}
