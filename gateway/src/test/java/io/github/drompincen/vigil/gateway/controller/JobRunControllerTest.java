package io.github.drompincen.vigil.gateway.controller;

import io.github.drompincen.vigil.protocol.api.JobRunResponse;
import io.github.drompincen.vigil.protocol.api.JobRunStatus;
import io.github.drompincen.vigil.protocol.api.TriggerSource;
import io.github.drompincen.vigil.runtime.job.JobRunService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobRunControllerTest {

    @Mock private JobRunService jobRunService;

    private JobRunController controller;

    @BeforeEach
    void setUp() {
        controller = new JobRunController(jobRunService);
    }

    @Test
    void listByScheduleIgnoresOtherFilters() {
        when(jobRunService.forSchedule("s1")).thenReturn(List.of(run("r1")));

        List<JobRunResponse> result = controller.list("tenant-1", "s1", "digest", JobRunStatus.FAILED, 0, 50);

        assertThat(result).extracting(JobRunResponse::jobRunId).containsExactly("r1");
        verify(jobRunService, never()).list(any(), any(), any(), anyInt(), anyInt());
    }

    @Test
    void listPassesFiltersAndPaging() {
        when(jobRunService.list("tenant-1", null, JobRunStatus.FAILED, 2, 20)).thenReturn(List.of(run("r2")));

        assertThat(controller.list("tenant-1", null, null, JobRunStatus.FAILED, 2, 20)).hasSize(1);
    }

    @Test
    void getReturns404WhenMissing() {
        when(jobRunService.get("nope")).thenReturn(Optional.empty());

        assertThat(controller.get("nope").getStatusCode().value()).isEqualTo(404);
    }

    private JobRunResponse run(String id) {
        return new JobRunResponse(id, "s1", "tenant-1", "digest", TriggerSource.SCHEDULED,
                JobRunStatus.COMPLETED, null, null, 1200L, Map.of("items", 3L), null);
    }
}
