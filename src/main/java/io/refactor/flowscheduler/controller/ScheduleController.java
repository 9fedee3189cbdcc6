package io.refactor.flowscheduler.controller;

import io.refactor.flowscheduler.dto.CreateScheduleRequest;
import io.refactor.flowscheduler.dto.JobResponse;
import io.refactor.flowscheduler.dto.ScheduleResponse;
import io.refactor.flowscheduler.dto.UpdateScheduleRequest;
import io.refactor.flowscheduler.service.ScheduleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Schedule management API. The caller has already been authenticated by the gateway,
 * which forwards the user's id in {@value #USER_HEADER}.
 */
@RestController
@RequestMapping("/api/schedules")
public class ScheduleController {
    static final String USER_HEADER = "X-User-Id";

    private final ScheduleService service;

    public ScheduleController(ScheduleService service) {
        this.service = service;
    }

    @PostMapping
    public ResponseEntity<ScheduleResponse> createSchedule(@RequestHeader(USER_HEADER) UUID userId,
                                                           @RequestBody @Valid CreateScheduleRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ScheduleResponse.from(service.create(userId, req)));
    }

    @GetMapping
    public ResponseEntity<List<ScheduleResponse>> list(@RequestHeader(USER_HEADER) UUID userId,
                                                       @RequestParam(required = false) UUID flowId) {
        List<ScheduleResponse> body = service.list(userId, flowId).stream()
                .map(ScheduleResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/jobs")
    public ResponseEntity<List<JobResponse>> jobs(@RequestHeader(USER_HEADER) UUID userId) {
        return ResponseEntity.ok(service.jobs(userId).stream().map(JobResponse::from).collect(Collectors.toList()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ScheduleResponse> get(@RequestHeader(USER_HEADER) UUID userId, @PathVariable UUID id) {
        return ResponseEntity.ok(ScheduleResponse.from(service.get(userId, id)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ScheduleResponse> update(@RequestHeader(USER_HEADER) UUID userId, @PathVariable UUID id,
                                                   @RequestBody @Valid UpdateScheduleRequest req) {
        return ResponseEntity.ok(ScheduleResponse.from(service.update(userId, id, req)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@RequestHeader(USER_HEADER) UUID userId, @PathVariable UUID id) {
        service.delete(userId, id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<ScheduleResponse> pause(@RequestHeader(USER_HEADER) UUID userId, @PathVariable UUID id) {
        return ResponseEntity.ok(ScheduleResponse.from(service.pause(userId, id)));
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<ScheduleResponse> resume(@RequestHeader(USER_HEADER) UUID userId, @PathVariable UUID id) {
        return ResponseEntity.ok(ScheduleResponse.from(service.resume(userId, id)));
    }
}
