package com.govcontracts.api;

import com.govcontracts.domain.model.CachedTaskResult;
import com.govcontracts.domain.model.TaskRequest;
import com.govcontracts.domain.model.TaskSubmission;
import com.govcontracts.domain.model.TaskView;
import com.govcontracts.domain.service.TaskOrchestrator;
import com.govcontracts.infrastructure.messaging.TaskEventPublisher;
import com.govcontracts.infrastructure.messaging.TaskSubscriptionRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;

/**
 * REST API for background tasks.
 *
 * Endpoints:
 * - POST /api/v1/tasks - Submit a task
 * - GET /api/v1/tasks/{taskId} - Task status and result
 * - POST /api/v1/tasks/{taskId}/cancel - Cancel a task
 * - GET /api/v1/tasks/{taskId}/events - SSE stream for one task
 * - GET /api/v1/tasks/events - SSE stream for all tasks
 * - GET /api/v1/tasks/results/{cacheKey} - Cached terminal result
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final TaskOrchestrator taskOrchestrator;
    private final TaskSubscriptionRegistry subscriptionRegistry;

    /**
     * Submit a task.
     *
     * Request body:
     * {
     *   "kind": "SEARCH|AGGREGATES|AGGREGATES_PAGINATED|VALUE_DISTRIBUTION|FILTER_OPTIONS|EXPORT_CSV",
     *   "params": { ... }
     * }
     *
     * Response is 202 with status "queued", or 200 with status "cached" when
     * the result is already available under cache_key.
     */
    @PostMapping
    public ResponseEntity<TaskSubmission> submit(@Valid @RequestBody TaskRequest request) {
        log.info("Submit task: kind={}", request.getKind());
        TaskSubmission submission = taskOrchestrator.submit(request);
        HttpStatus status = TaskSubmission.CACHED.equals(submission.getStatus()) ? HttpStatus.OK : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(submission);
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<TaskView> getTask(@PathVariable UUID taskId) {
        return ResponseEntity.ok(taskOrchestrator.getTask(taskId));
    }

    @PostMapping("/{taskId}/cancel")
    public ResponseEntity<TaskView> cancel(@PathVariable UUID taskId) {
        log.info("Cancel task: taskId={}", taskId);
        return ResponseEntity.ok(taskOrchestrator.cancel(taskId));
    }

    @GetMapping(path = "/{taskId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter taskEvents(@PathVariable UUID taskId) {
        taskOrchestrator.getTask(taskId);
        return subscriptionRegistry.subscribe(TaskEventPublisher.taskChannel(taskId));
    }

    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter allEvents() {
        return subscriptionRegistry.subscribe(TaskEventPublisher.ALL_CHANNEL);
    }

    @GetMapping("/results/{cacheKey}")
    public ResponseEntity<CachedTaskResult> result(@PathVariable String cacheKey) {
        return ResponseEntity.ok(taskOrchestrator.getCachedResult(cacheKey));
    }
}
