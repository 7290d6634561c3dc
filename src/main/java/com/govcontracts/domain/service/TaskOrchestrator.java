package com.govcontracts.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govcontracts.domain.exception.ContractsException;
import com.govcontracts.domain.exception.ErrorKind;
import com.govcontracts.domain.model.CachedTaskResult;
import com.govcontracts.domain.model.TaskEvent;
import com.govcontracts.domain.model.TaskKind;
import com.govcontracts.domain.model.TaskRequest;
import com.govcontracts.domain.model.TaskState;
import com.govcontracts.domain.model.TaskSubmission;
import com.govcontracts.domain.model.TaskView;
import com.govcontracts.infrastructure.cache.QueryCacheService;
import com.govcontracts.infrastructure.messaging.TaskEventPublisher;
import com.govcontracts.infrastructure.persistence.entity.TaskEntity;
import com.govcontracts.infrastructure.persistence.repository.TaskRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Background task processor for heavy queries and file exports.
 *
 * Processing Flow:
 * 1. Client submits a task → record created as PENDING (or answered from cache)
 * 2. Client receives task ID and cache key immediately
 * 3. Poller claims due tasks (PENDING, or RETRY past nextAttemptAt) as STARTED
 * 4. Worker pool runs the attempt, reporting PROGRESS
 * 5. SUCCESS or FAILURE is stored on the record and cached under the cache key
 *
 * Every transition is broadcast on {@code tasks:<id>} and {@code tasks:all}.
 *
 * Failure Handling:
 * - Validation errors and cancellation fail immediately
 * - Other errors move to RETRY with a fixed backoff until the budget is spent
 *
 * Cancellation sets {@code cancelRequested} through a targeted update and is
 * honoured at every progress checkpoint, before a retry is scheduled and
 * before a result is stored. Claim, progress and retry writes are
 * conditional updates, so a cancel that lands between a read and a write
 * is never overwritten. A cancelled task ends in FAILURE and is not cached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskOrchestrator {

    static final String CACHE_KEY_PREFIX = "task-result:";
    static final String CANCELLED_MESSAGE = "Task cancelled";

    private static final Set<TaskState> DUE_STATES = EnumSet.of(TaskState.PENDING, TaskState.RETRY);
    private static final Set<TaskState> RUNNING_STATES = EnumSet.of(TaskState.STARTED, TaskState.PROGRESS);

    private final TaskRepository taskRepository;
    private final TaskDispatcher taskDispatcher;
    private final QueryCacheService cacheService;
    private final TaskEventPublisher eventPublisher;
    private final ThreadPoolTaskExecutor taskWorkerExecutor;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @Value("${app.tasks.max-retries:3}")
    private int maxRetries;

    @Value("${app.tasks.retry-backoff-seconds:30}")
    private long retryBackoffSeconds;

    @Value("${app.cache.ttl.task-result:1800}")
    private long resultTtl;

    @Value("${app.cache.ttl.task-error:300}")
    private long errorTtl;

    /**
     * Queue a task, unless a successful result for the same kind and params
     * is already cached.
     */
    public TaskSubmission submit(TaskRequest request) {
        TaskKind kind = request.getKind();
        Object params = taskDispatcher.readParams(kind, request.getParams());
        String cacheKey = cacheKey(kind, params);

        boolean cached = cacheService.get(cacheKey, CachedTaskResult.class)
                .map(CachedTaskResult::isSuccess)
                .orElse(false);
        if (cached) {
            log.info("Task {} answered from cache: {}", kind, cacheKey);
            return TaskSubmission.builder()
                    .cacheKey(cacheKey)
                    .status(TaskSubmission.CACHED)
                    .build();
        }

        TaskEntity task = TaskEntity.builder()
                .kind(kind)
                .params(toJson(params))
                .cacheKey(cacheKey)
                .maxRetries(maxRetries)
                .build();
        task = taskRepository.save(task);

        log.info("Task submitted: {} (kind: {})", task.getTaskId(), kind);
        transitioned(task, null);

        return TaskSubmission.builder()
                .taskId(task.getTaskId())
                .cacheKey(cacheKey)
                .status(TaskSubmission.QUEUED)
                .build();
    }

    public TaskView getTask(UUID taskId) {
        return toView(load(taskId));
    }

    /**
     * Cancel a task. Queued tasks fail at once; running tasks are flagged and
     * stop at their next progress checkpoint; finished tasks are unchanged.
     */
    public TaskView cancel(UUID taskId) {
        TaskEntity task = load(taskId);

        if (task.getState().isTerminal()) {
            log.debug("Cancel ignored for finished task {}", taskId);
            return toView(task);
        }

        taskRepository.requestCancel(taskId);

        if (task.getState().isRunning()) {
            log.info("Cancellation requested for running task {}", taskId);
            return toView(load(taskId));
        }

        log.info("Cancelling queued task {}", taskId);
        return toView(finishCancelled(load(taskId)));
    }

    public CachedTaskResult getCachedResult(String cacheKey) {
        return cacheService.get(cacheKey, CachedTaskResult.class)
                .orElseGet(CachedTaskResult::notReady);
    }

    /**
     * Claim due tasks and hand them to the worker pool.
     */
    @Scheduled(fixedDelayString = "${app.tasks.poll-interval-ms:1000}")
    public void processDueTasks() {
        try {
            List<TaskEntity> due = taskRepository
                    .findTop10ByStateInAndNextAttemptAtLessThanEqualOrderByCreatedAtAsc(DUE_STATES, Instant.now());

            if (due.isEmpty()) {
                return;
            }

            log.debug("Dispatching {} due tasks", due.size());

            for (TaskEntity task : due) {
                claimAndDispatch(task);
            }

        } catch (Exception e) {
            log.error("Error polling due tasks: {}", e.getMessage(), e);
        }
    }

    /**
     * Run one attempt of a claimed task on the calling thread.
     */
    public void executeAttempt(UUID taskId) {
        TaskEntity task = taskRepository.findById(taskId).orElse(null);
        if (task == null || task.getState().isTerminal()) {
            log.debug("Skipping attempt for task {}: no longer runnable", taskId);
            return;
        }

        log.info("Processing task: {} (kind: {}, attempt {})", taskId, task.getKind(), task.getRetryCount() + 1);

        try {
            Object params = taskDispatcher.readParams(task.getKind(), task.getParams());
            Object result = taskDispatcher.dispatch(taskId, task.getKind(), params,
                    (progress, message) -> reportProgress(taskId, progress, message));
            succeed(taskId, objectMapper.valueToTree(result));

        } catch (TaskCancelledException e) {
            log.info("Task {} stopped on cancellation", taskId);
            finishCancelled(load(taskId));

        } catch (ContractsException e) {
            if (e.getKind().isValidation()) {
                log.warn("Task {} rejected: {}", taskId, e.getMessage());
                fail(taskId, e.getMessage());
            } else {
                retryOrFail(taskId, e);
            }

        } catch (Exception e) {
            retryOrFail(taskId, e);
        }
    }

    private void claimAndDispatch(TaskEntity task) {
        UUID taskId = task.getTaskId();
        TaskState previous = task.getState();

        task.markStarted();
        int claimed = taskRepository.claim(taskId, DUE_STATES, TaskState.STARTED, task.getStatusMessage(),
                task.getStartedAt());
        if (claimed == 0) {
            log.debug("Task {} left {} before it was claimed", taskId, previous);
            return;
        }
        transitioned(task, null);

        try {
            taskWorkerExecutor.execute(() -> executeAttempt(taskId));
        } catch (TaskRejectedException e) {
            log.warn("Worker pool full, task {} returned to {}", taskId, previous);
            taskRepository.release(taskId, TaskState.STARTED, previous);
        }
    }

    private void reportProgress(UUID taskId, int progress, String message) {
        TaskEntity task = load(taskId);
        if (task.isCancelRequested()) {
            throw new TaskCancelledException(taskId);
        }
        task.markProgress(progress, message);
        int updated = taskRepository.updateProgress(taskId, RUNNING_STATES, TaskState.PROGRESS, task.getProgress(),
                task.getStatusMessage());
        if (updated == 0) {
            throw new TaskCancelledException(taskId);
        }
        publish(task, null);
    }

    private void succeed(UUID taskId, JsonNode result) {
        TaskEntity task = load(taskId);
        if (task.isCancelRequested()) {
            log.info("Task {} finished after cancellation, result discarded", taskId);
            finishCancelled(task);
            return;
        }
        if (task.getState().isTerminal()) {
            return;
        }
        task.markSucceeded(toJson(result));
        taskRepository.save(task);

        cacheService.set(task.getCacheKey(), CachedTaskResult.success(result), resultTtl);
        log.info("Task completed: {} ({} ms)", taskId, task.getExecutionTimeMs());
        transitioned(task, result);
    }

    private void retryOrFail(UUID taskId, Exception e) {
        TaskEntity task = load(taskId);
        if (task.isCancelRequested()) {
            log.info("Task {} failed after cancellation: {}", taskId, e.getMessage());
            finishCancelled(task);
            return;
        }
        if (task.getState().isTerminal()) {
            return;
        }
        if (!task.hasRetriesLeft()) {
            log.error("Task {} failed after {} retries: {}", taskId, task.getRetryCount(), e.getMessage(), e);
            fail(taskId, e.getMessage());
            return;
        }

        Instant nextAttemptAt = Instant.now().plus(Duration.ofSeconds(retryBackoffSeconds));
        task.markRetry(e.getMessage(), nextAttemptAt);
        int scheduled = taskRepository.scheduleRetry(taskId, TaskState.RETRY, task.getStatusMessage(),
                task.getErrorMessage(), nextAttemptAt);
        if (scheduled == 0) {
            finishCancelled(load(taskId));
            return;
        }

        log.warn("Task {} attempt failed, retry {} of {} at {}: {}",
                taskId, task.getRetryCount(), task.getMaxRetries(), nextAttemptAt, e.getMessage());
        transitioned(task, null);
    }

    private void fail(UUID taskId, String error) {
        TaskEntity task = load(taskId);
        if (task.getState().isTerminal()) {
            return;
        }
        task.markFailed(error);
        taskRepository.save(task);

        cacheService.set(task.getCacheKey(), CachedTaskResult.error(error), errorTtl);
        transitioned(task, null);
    }

    private TaskEntity finishCancelled(TaskEntity task) {
        if (task.getState().isTerminal()) {
            return task;
        }
        task.markFailed(CANCELLED_MESSAGE);
        taskRepository.save(task);
        transitioned(task, null);
        return task;
    }

    private void transitioned(TaskEntity task, JsonNode result) {
        Counter.builder("task.transitions")
                .tag("state", task.getState().name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
        publish(task, result);
    }

    private void publish(TaskEntity task, JsonNode result) {
        eventPublisher.publish(TaskEvent.builder()
                .taskId(task.getTaskId())
                .state(task.getState())
                .status(task.getStatusMessage())
                .progress(task.getProgress())
                .result(result)
                .error(task.getState() == TaskState.SUCCESS ? null : task.getErrorMessage())
                .build());
    }

    private TaskEntity load(UUID taskId) {
        return taskRepository.findById(taskId)
                .orElseThrow(() -> new ContractsException(ErrorKind.TASK_NOT_FOUND, "Task not found: " + taskId));
    }

    private String cacheKey(TaskKind kind, Object params) {
        return cacheService.generateCacheKey(CACHE_KEY_PREFIX + kind.name().toLowerCase(Locale.ROOT), params);
    }

    private TaskView toView(TaskEntity task) {
        return TaskView.builder()
                .taskId(task.getTaskId())
                .kind(task.getKind())
                .state(task.getState())
                .progress(task.getProgress())
                .status(task.getStatusMessage())
                .cacheKey(task.getCacheKey())
                .result(task.getResult() == null ? null : readTree(task.getResult()))
                .error(task.getErrorMessage())
                .retryCount(task.getRetryCount())
                .maxRetries(task.getMaxRetries())
                .createdAt(task.getCreatedAt())
                .startedAt(task.getStartedAt())
                .completedAt(task.getCompletedAt())
                .build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize task payload", e);
        }
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored task result is not valid JSON", e);
        }
    }
}
