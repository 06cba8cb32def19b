package io.github.drompincen.vigil.gateway.controller;

import io.github.drompincen.vigil.protocol.api.SchedulerStatusResponse;
import io.github.drompincen.vigil.protocol.event.SchedulerEvent;
import io.github.drompincen.vigil.runtime.event.SchedulerEventService;
import io.github.drompincen.vigil.runtime.scheduler.TriggerEngine;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {

    private final TriggerEngine triggerEngine;
    private final SchedulerEventService eventService;

    public SchedulerController(TriggerEngine triggerEngine, SchedulerEventService eventService) {
        this.triggerEngine = triggerEngine;
        this.eventService = eventService;
    }

    @GetMapping("/status")
    public SchedulerStatusResponse status() {
        return triggerEngine.status();
    }

    @GetMapping("/events")
    public List<SchedulerEvent> events(@RequestParam(required = false) String tenantId,
                                       @RequestParam(defaultValue = "50") int limit) {
        return eventService.recent(tenantId, Math.min(limit, 500));
    }
}
