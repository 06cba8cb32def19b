package io.github.drompincen.vigil.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.vigil.protocol.api.BreakerAction;
import io.github.drompincen.vigil.protocol.api.BreakerControlRequest;
import io.github.drompincen.vigil.protocol.api.ScheduleRequest;
import io.github.drompincen.vigil.protocol.api.ScheduleType;
import io.github.drompincen.vigil.protocol.api.JobRunResponse;
import io.github.drompincen.vigil.protocol.api.JobRunStatus;
import io.github.drompincen.vigil.protocol.api.TriggerSource;
import io.github.drompincen.vigil.runtime.job.JobContext;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JacksonConfigTest {

    private final ObjectMapper mapper = new JacksonConfig().objectMapper();

    record DigestConfig(int lookbackDays, String channel) {}

    @Test
    void scheduleRequestAcceptsLowercaseScheduleType() throws Exception {
        ScheduleRequest req = mapper.readValue("{\"tenantId\":\"t1\",\"name\":\"Morning sweep\","
                + "\"jobType\":\"digest\",\"scheduleType\":\"weekly\",\"hourOfDay\":9,\"dayOfWeek\":0}",
                ScheduleRequest.class);

        assertThat(req.scheduleType()).isEqualTo(ScheduleType.WEEKLY);
        assertThat(req.dayOfWeek()).isZero();
    }

    @Test
    void breakerControlAcceptsLowercaseAction() throws Exception {
        BreakerControlRequest req = mapper.readValue(
                "{\"action\":\"disable\",\"reason\":\"quota\",\"actor\":\"ops\"}", BreakerControlRequest.class);

        assertThat(req.action()).isEqualTo(BreakerAction.DISABLE);
    }

    @Test
    void jobConfigIgnoresKeysTheJobDoesNotDeclare() {
        JobContext ctx = new JobContext("t1", List.of(), Map.of("lookbackDays", 7, "channel", "email",
                "legacyFlag", true), "run-1", "s1", mapper);

        DigestConfig config = ctx.configAs(DigestConfig.class);

        assertThat(config.lookbackDays()).isEqualTo(7);
        assertThat(config.channel()).isEqualTo("email");
    }

    @Test
    void instantsAreWrittenAsIsoStrings() throws Exception {
        JobRunResponse run = new JobRunResponse("run-1", "s1", "t1", "digest", TriggerSource.SCHEDULED,
                JobRunStatus.COMPLETED, Instant.parse("2024-03-01T09:00:00Z"), null, 1200L, Map.of(), null);

        String json = mapper.writeValueAsString(run);

        assertThat(json).contains("\"startedAt\":\"2024-03-01T09:00:00Z\"")
                .contains("\"status\":\"COMPLETED\"");
    }
}
