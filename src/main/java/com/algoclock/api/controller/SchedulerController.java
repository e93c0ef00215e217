package com.algoclock.api.controller;

import com.algoclock.api.dto.response.ScheduledEventResponse;
import com.algoclock.api.dto.response.SchedulerStatusResponse;
import com.algoclock.service.SchedulerService;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inspection endpoints for the live scheduler.
 *
 * <ul>
 *   <li>GET /api/scheduler/events -- registered events in firing order</li>
 *   <li>GET /api/scheduler/status -- sampler state and counters</li>
 *   <li>DELETE /api/scheduler/events/{name} -- removes every event with that name, 404 if none</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {

    private final SchedulerService schedulerService;

    public SchedulerController(SchedulerService schedulerService) {
        this.schedulerService = schedulerService;
    }

    @GetMapping("/events")
    public ResponseEntity<List<ScheduledEventResponse>> getScheduledEvents() {
        return ResponseEntity.ok(schedulerService.getScheduledEvents());
    }

    @GetMapping("/status")
    public ResponseEntity<SchedulerStatusResponse> getStatus() {
        return ResponseEntity.ok(schedulerService.getStatus());
    }

    @DeleteMapping("/events/{name}")
    public ResponseEntity<Map<String, Object>> removeScheduledEvents(@PathVariable String name) {
        int removed = schedulerService.removeScheduledEvents(name);
        return ResponseEntity.ok(Map.of("name", name, "removed", removed));
    }
}
