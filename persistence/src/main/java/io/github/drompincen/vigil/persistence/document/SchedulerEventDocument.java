package io.github.drompincen.vigil.persistence.document;

import io.github.drompincen.vigil.protocol.event.SchedulerEventType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Document(collection = "scheduler_events")
@CompoundIndex(name = "tenant_timestamp_idx", def = "{'tenantId': 1, 'timestamp': -1}")
public class SchedulerEventDocument {

    @Id
    private String eventId;
    private String tenantId;
    private SchedulerEventType type;
    private String subjectId;
    private Map<String, Object> payload;
    private Instant timestamp;

    public SchedulerEventDocument() {}

    public String getEventId() { return eventId; }
    public void setEventId(String eventId) { this.eventId = eventId; }

    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }

    public SchedulerEventType getType() { return type; }
    public void setType(SchedulerEventType type) { this.type = type; }

    public String getSubjectId() { return subjectId; }
    public void setSubjectId(String subjectId) { this.subjectId = subjectId; }

    public Map<String, Object> getPayload() { return payload; }
    public void setPayload(Map<String, Object> payload) { this.payload = payload; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
}
