package io.github.drompincen.vigil.runtime.job;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JobRegistryTest {

    @Test
    void resolvesRegisteredJobByType() throws Exception {
        JobRegistry registry = new JobRegistry(List.of(job("client_monitoring"), job("notification_digest")));

        assertThat(registry.jobTypes()).containsExactly("client_monitoring", "notification_digest");
        assertThat(registry.supports("client_monitoring")).isTrue();
        assertThat(registry.resolve("client_monitoring").run(null).success()).isTrue();
    }

    @Test
    void unknownType_resolvesToFailingBody() throws Exception {
        JobRegistry registry = new JobRegistry(List.of());

        JobResult result = registry.resolve("search_only").run(null);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Unknown job type: search_only");
        assertThat(registry.get(null)).isEmpty();
    }

    @Test
    void laterRegistration_replacesEarlier() throws Exception {
        JobRegistry registry = new JobRegistry(List.of(job("client_monitoring")));
        registry.register(new MonitoringJob() {
            @Override public String jobType() { return "client_monitoring"; }
            @Override public JobResult run(JobContext ctx) { return JobResult.failure("replaced"); }
        });

        assertThat(registry.jobTypes()).hasSize(1);
        assertThat(registry.resolve("client_monitoring").run(null).error()).isEqualTo("replaced");
    }

    private static MonitoringJob job(String type) {
        return new MonitoringJob() {
            @Override public String jobType() { return type; }
            @Override public JobResult run(JobContext ctx) { return JobResult.success(Map.of("clientsProcessed", 1L)); }
        };
    }
}
