package io.github.drompincen.vigil.runtime.event;

import io.github.drompincen.vigil.persistence.document.SchedulerEventDocument;
import io.github.drompincen.vigil.persistence.repository.SchedulerEventRepository;
import io.github.drompincen.vigil.protocol.event.SchedulerEvent;
import io.github.drompincen.vigil.protocol.event.SchedulerEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Fire-and-forget notification hook. Events are stored for the notification subsystem to
 * pick up; a failed write is logged and never reaches the caller.
 */
@Service
public class SchedulerEventService {

    private static final Logger log = LoggerFactory.getLogger(SchedulerEventService.class);

    private final SchedulerEventRepository eventRepository;
    private final Clock clock;

    public SchedulerEventService(SchedulerEventRepository eventRepository, Clock clock) {
        this.eventRepository = eventRepository;
        this.clock = clock;
    }

    public void publish(String tenantId, SchedulerEventType type, String subjectId, Map<String, Object> payload) {
        try {
            SchedulerEventDocument event = new SchedulerEventDocument();
            event.setEventId(UUID.randomUUID().toString());
            event.setTenantId(tenantId);
            event.setType(type);
            event.setSubjectId(subjectId);
            event.setPayload(payload);
            event.setTimestamp(clock.instant());
            eventRepository.save(event);
            log.debug("Published {} for {} (tenant={})", type, subjectId, tenantId);
        } catch (Exception e) {
            log.warn("Failed to publish {} for {}: {}", type, subjectId, e.getMessage());
        }
    }

    public List<SchedulerEvent> recent(String tenantId, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        List<SchedulerEventDocument> docs = tenantId != null
                ? eventRepository.findByTenantIdOrderByTimestampDesc(tenantId, page)
                : eventRepository.findAllByOrderByTimestampDesc(page);
        return docs.stream()
                .map(d -> new SchedulerEvent(d.getEventId(), d.getTenantId(), d.getType(),
                        d.getSubjectId(), d.getPayload(), d.getTimestamp()))
                .toList();
    }
}
