package com.govcontracts.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.govcontracts.domain.exception.ContractsException;
import com.govcontracts.domain.exception.ErrorKind;
import com.govcontracts.domain.exception.SearchException;
import com.govcontracts.domain.exception.ValidationException;
import com.govcontracts.domain.model.CachedTaskResult;
import com.govcontracts.domain.model.ContractSearchRequest;
import com.govcontracts.domain.model.ContractSearchResponse;
import com.govcontracts.domain.model.Pagination;
import com.govcontracts.domain.model.TaskEvent;
import com.govcontracts.domain.model.TaskKind;
import com.govcontracts.domain.model.TaskRequest;
import com.govcontracts.domain.model.TaskState;
import com.govcontracts.domain.model.TaskSubmission;
import com.govcontracts.domain.model.TaskView;
import com.govcontracts.infrastructure.cache.InMemoryRedis;
import com.govcontracts.infrastructure.cache.QueryCacheService;
import com.govcontracts.infrastructure.messaging.TaskEventPublisher;
import com.govcontracts.infrastructure.persistence.entity.TaskEntity;
import com.govcontracts.infrastructure.persistence.repository.TaskRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TaskOrchestrator.
 *
 * The repository is backed by a map and the worker pool runs inline, so a
 * poll cycle runs one attempt of every due task synchronously. Reads return
 * copies, like detached JPA entities, and the targeted updates act on the
 * stored row. Retry backoff is zero, so a task in RETRY is due on the next poll.
 */
@ExtendWith(MockitoExtension.class)
class TaskOrchestratorTest {

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private TaskDispatcher taskDispatcher;

    @Mock
    private TaskEventPublisher eventPublisher;

    @Mock
    private ThreadPoolTaskExecutor taskWorkerExecutor;

    private final Map<UUID, TaskEntity> store = new ConcurrentHashMap<>();
    private final ContractSearchRequest searchRequest = ContractSearchRequest.builder().page(1).pageSize(10).build();

    private MeterRegistry meterRegistry;
    private QueryCacheService cacheService;
    private TaskOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();
        meterRegistry = new SimpleMeterRegistry();
        cacheService = new QueryCacheService(new InMemoryRedis().template(), objectMapper);
        orchestrator = new TaskOrchestrator(taskRepository, taskDispatcher, cacheService, eventPublisher,
                taskWorkerExecutor, objectMapper, meterRegistry);
        ReflectionTestUtils.setField(orchestrator, "maxRetries", 3);
        ReflectionTestUtils.setField(orchestrator, "retryBackoffSeconds", 0L);
        ReflectionTestUtils.setField(orchestrator, "resultTtl", 1800L);
        ReflectionTestUtils.setField(orchestrator, "errorTtl", 300L);

        lenient().when(taskRepository.save(any(TaskEntity.class))).thenAnswer(invocation -> {
            TaskEntity task = invocation.getArgument(0);
            if (task.getTaskId() == null) {
                task.setTaskId(UUID.randomUUID());
                task.setCreatedAt(Instant.now());
                task.setNextAttemptAt(task.getCreatedAt());
            }
            store.put(task.getTaskId(), task.toBuilder().build());
            return task;
        });
        lenient().when(taskRepository.findById(any(UUID.class))).thenAnswer(invocation ->
                Optional.ofNullable(store.get(invocation.<UUID>getArgument(0))).map(task -> task.toBuilder().build()));
        lenient().when(taskRepository.findTop10ByStateInAndNextAttemptAtLessThanEqualOrderByCreatedAtAsc(any(), any()))
                .thenAnswer(invocation -> {
                    Collection<TaskState> states = invocation.getArgument(0);
                    Instant now = invocation.getArgument(1);
                    return store.values().stream()
                            .filter(task -> states.contains(task.getState()))
                            .filter(task -> !task.getNextAttemptAt().isAfter(now))
                            .sorted(Comparator.comparing(TaskEntity::getCreatedAt))
                            .limit(10)
                            .map(task -> task.toBuilder().build())
                            .toList();
                });
        lenient().when(taskRepository.claim(any(UUID.class), any(), any(), any(), any())).thenAnswer(invocation -> {
            TaskEntity task = store.get(invocation.<UUID>getArgument(0));
            if (!invocation.<Collection<TaskState>>getArgument(1).contains(task.getState())) {
                return 0;
            }
            task.setState(invocation.getArgument(2));
            task.setStatusMessage(invocation.getArgument(3));
            task.setStartedAt(invocation.getArgument(4));
            return 1;
        });
        lenient().when(taskRepository.release(any(UUID.class), any(), any())).thenAnswer(invocation -> {
            TaskEntity task = store.get(invocation.<UUID>getArgument(0));
            if (task.getState() != invocation.getArgument(1)) {
                return 0;
            }
            task.setState(invocation.getArgument(2));
            return 1;
        });
        lenient().when(taskRepository.updateProgress(any(UUID.class), any(), any(), anyInt(), any()))
                .thenAnswer(invocation -> {
                    TaskEntity task = store.get(invocation.<UUID>getArgument(0));
                    if (!invocation.<Collection<TaskState>>getArgument(1).contains(task.getState())) {
                        return 0;
                    }
                    task.setState(invocation.getArgument(2));
                    task.setProgress(invocation.<Integer>getArgument(3));
                    task.setStatusMessage(invocation.getArgument(4));
                    return 1;
                });
        lenient().when(taskRepository.scheduleRetry(any(UUID.class), any(), any(), any(), any()))
                .thenAnswer(invocation -> {
                    TaskEntity task = store.get(invocation.<UUID>getArgument(0));
                    if (task.isCancelRequested()) {
                        return 0;
                    }
                    task.setState(invocation.getArgument(1));
                    task.setRetryCount(task.getRetryCount() + 1);
                    task.setStatusMessage(invocation.getArgument(2));
                    task.setErrorMessage(invocation.getArgument(3));
                    task.setNextAttemptAt(invocation.getArgument(4));
                    return 1;
                });
        lenient().when(taskRepository.requestCancel(any(UUID.class))).thenAnswer(invocation -> {
            store.get(invocation.<UUID>getArgument(0)).setCancelRequested(true);
            return 1;
        });
        lenient().doAnswer(invocation -> {
            invocation.<Runnable>getArgument(0).run();
            return null;
        }).when(taskWorkerExecutor).execute(any(Runnable.class));

        lenient().when(taskDispatcher.readParams(eq(TaskKind.SEARCH), any(JsonNode.class))).thenReturn(searchRequest);
        lenient().when(taskDispatcher.readParams(eq(TaskKind.SEARCH), anyString())).thenReturn(searchRequest);
    }

    @Test
    void testSubmit_QueuesPendingTask() {
        // When
        TaskSubmission submission = orchestrator.submit(searchTask());

        // Then
        assertEquals(TaskSubmission.QUEUED, submission.getStatus());
        assertNotNull(submission.getTaskId());
        assertTrue(submission.getCacheKey().startsWith("task-result:search:"));
        assertEquals(TaskState.PENDING, store.get(submission.getTaskId()).getState());
        assertEquals(3, store.get(submission.getTaskId()).getMaxRetries());
        verify(eventPublisher).publish(argThat(event -> event.getState() == TaskState.PENDING));
    }

    @Test
    void testSubmit_CachedResultShortCircuits() {
        // Given
        String cacheKey = cacheService.generateCacheKey("task-result:search", searchRequest);
        cacheService.set(cacheKey, CachedTaskResult.success(null), 60);

        // When
        TaskSubmission submission = orchestrator.submit(searchTask());

        // Then
        assertEquals(TaskSubmission.CACHED, submission.getStatus());
        assertEquals(cacheKey, submission.getCacheKey());
        assertNull(submission.getTaskId());
        verify(taskRepository, never()).save(any());
    }

    @Test
    void testSubmit_InvalidParamsRejected() {
        // Given
        when(taskDispatcher.readParams(eq(TaskKind.SEARCH), any(JsonNode.class)))
                .thenThrow(new ValidationException(ErrorKind.INVALID_SORT_FIELD, "bad sort"));

        // When / Then
        assertThrows(ValidationException.class, () -> orchestrator.submit(searchTask()));
        assertTrue(store.isEmpty());
    }

    @Test
    void testRetry_SucceedsAfterTransientFailures() {
        // Given
        UUID taskId = orchestrator.submit(searchTask()).getTaskId();
        when(taskDispatcher.dispatch(eq(taskId), eq(TaskKind.SEARCH), any(), any()))
                .thenThrow(new SearchException("engine busy"))
                .thenThrow(new SearchException("engine busy"))
                .thenThrow(new SearchException("engine busy"))
                .thenReturn(successfulSearch());

        // When
        for (int poll = 0; poll < 4; poll++) {
            orchestrator.processDueTasks();
        }

        // Then
        TaskView view = orchestrator.getTask(taskId);
        assertEquals(TaskState.SUCCESS, view.getState());
        assertEquals(3, view.getRetryCount());
        assertEquals(100, view.getProgress());
        assertTrue(view.getResult().get("success").asBoolean());
        assertTrue(orchestrator.getCachedResult(view.getCacheKey()).isSuccess());
        assertEquals(3.0, meterRegistry.counter("task.transitions", "state", "retry").count());
    }

    @Test
    void testRetry_BudgetExhaustedEndsInFailure() {
        // Given
        UUID taskId = orchestrator.submit(searchTask()).getTaskId();
        when(taskDispatcher.dispatch(eq(taskId), eq(TaskKind.SEARCH), any(), any()))
                .thenThrow(new SearchException("engine down"));

        // When
        for (int poll = 0; poll < 6; poll++) {
            orchestrator.processDueTasks();
        }

        // Then
        TaskView view = orchestrator.getTask(taskId);
        assertEquals(TaskState.FAILURE, view.getState());
        assertEquals("engine down", view.getError());
        verify(taskDispatcher, times(4)).dispatch(eq(taskId), eq(TaskKind.SEARCH), any(), any());
        CachedTaskResult cached = orchestrator.getCachedResult(view.getCacheKey());
        assertEquals(CachedTaskResult.ERROR, cached.getStatus());
    }

    @Test
    void testExecute_ValidationErrorIsNotRetried() {
        // Given
        UUID taskId = orchestrator.submit(searchTask()).getTaskId();
        when(taskDispatcher.dispatch(eq(taskId), eq(TaskKind.SEARCH), any(), any()))
                .thenThrow(new ValidationException("num_bins out of range"));

        // When
        orchestrator.processDueTasks();
        orchestrator.processDueTasks();

        // Then
        assertEquals(TaskState.FAILURE, orchestrator.getTask(taskId).getState());
        verify(taskDispatcher, times(1)).dispatch(any(), any(), any(), any());
    }

    @Test
    void testCancel_QueuedTaskFailsImmediately() {
        // Given
        UUID taskId = orchestrator.submit(searchTask()).getTaskId();

        // When
        TaskView view = orchestrator.cancel(taskId);
        orchestrator.processDueTasks();

        // Then
        assertEquals(TaskState.FAILURE, view.getState());
        assertEquals("Task cancelled", view.getError());
        assertTrue(store.get(taskId).isCancelRequested());
        verify(taskDispatcher, never()).dispatch(any(), any(), any(), any());
    }

    @Test
    void testCancel_RunningTaskStopsAtNextCheckpoint() {
        // Given
        UUID taskId = orchestrator.submit(searchTask()).getTaskId();
        store.get(taskId).markStarted();
        when(taskDispatcher.dispatch(eq(taskId), eq(TaskKind.SEARCH), any(), any())).thenAnswer(invocation -> {
            invocation.<ProgressReporter>getArgument(3).report(50, "halfway");
            return successfulSearch();
        });

        // When
        TaskView requested = orchestrator.cancel(taskId);
        orchestrator.executeAttempt(taskId);

        // Then
        assertEquals(TaskState.STARTED, requested.getState());
        TaskView view = orchestrator.getTask(taskId);
        assertEquals(TaskState.FAILURE, view.getState());
        assertEquals("Task cancelled", view.getError());
        assertEquals(0, view.getRetryCount());
    }

    @Test
    void testCancel_AfterLastCheckpointDiscardsResult() {
        // Given
        UUID taskId = orchestrator.submit(searchTask()).getTaskId();
        when(taskDispatcher.dispatch(eq(taskId), eq(TaskKind.SEARCH), any(), any())).thenAnswer(invocation -> {
            invocation.<ProgressReporter>getArgument(3).report(5, "Running search");
            orchestrator.cancel(taskId);
            return successfulSearch();
        });

        // When
        orchestrator.processDueTasks();

        // Then
        TaskView view = orchestrator.getTask(taskId);
        assertEquals(TaskState.FAILURE, view.getState());
        assertEquals("Task cancelled", view.getError());
        assertNull(view.getResult());
        assertEquals(CachedTaskResult.NOT_READY, orchestrator.getCachedResult(view.getCacheKey()).getStatus());
    }

    @Test
    void testCancel_FailedAttemptAfterCancelIsNotRetried() {
        // Given
        UUID taskId = orchestrator.submit(searchTask()).getTaskId();
        when(taskDispatcher.dispatch(eq(taskId), eq(TaskKind.SEARCH), any(), any())).thenAnswer(invocation -> {
            orchestrator.cancel(taskId);
            throw new SearchException("engine busy");
        });

        // When
        orchestrator.processDueTasks();
        orchestrator.processDueTasks();

        // Then
        TaskView view = orchestrator.getTask(taskId);
        assertEquals(TaskState.FAILURE, view.getState());
        assertEquals("Task cancelled", view.getError());
        assertEquals(0, view.getRetryCount());
        verify(taskDispatcher, times(1)).dispatch(any(), any(), any(), any());
    }

    @Test
    void testCancel_LandingDuringProgressWriteIsKept() {
        // Given
        UUID taskId = orchestrator.submit(searchTask()).getTaskId();
        when(taskRepository.updateProgress(eq(taskId), any(), any(), anyInt(), any())).thenAnswer(invocation -> {
            store.get(taskId).setCancelRequested(true);
            TaskEntity task = store.get(taskId);
            task.setState(invocation.getArgument(2));
            task.setProgress(invocation.<Integer>getArgument(3));
            return 1;
        });
        when(taskDispatcher.dispatch(eq(taskId), eq(TaskKind.SEARCH), any(), any())).thenAnswer(invocation -> {
            ProgressReporter reporter = invocation.getArgument(3);
            reporter.report(20, "first batch");
            reporter.report(60, "second batch");
            return successfulSearch();
        });

        // When
        orchestrator.processDueTasks();

        // Then
        TaskView view = orchestrator.getTask(taskId);
        assertEquals(TaskState.FAILURE, view.getState());
        assertEquals("Task cancelled", view.getError());
        assertEquals(20, view.getProgress());
        verify(taskRepository, never()).save(argThat(task -> task.getState() == TaskState.PROGRESS));
    }

    @Test
    void testPoll_QueuedTaskCancelledBeforeClaimIsNotRun() {
        // Given
        UUID taskId = orchestrator.submit(searchTask()).getTaskId();
        when(taskRepository.claim(eq(taskId), any(), any(), any(), any())).thenAnswer(invocation -> {
            orchestrator.cancel(taskId);
            return store.get(taskId).getState().isTerminal() ? 0 : 1;
        });

        // When
        orchestrator.processDueTasks();

        // Then
        assertEquals(TaskState.FAILURE, store.get(taskId).getState());
        verify(taskDispatcher, never()).dispatch(any(), any(), any(), any());
    }

    @Test
    void testCancel_FinishedTaskUnchanged() {
        // Given
        UUID taskId = orchestrator.submit(searchTask()).getTaskId();
        when(taskDispatcher.dispatch(eq(taskId), eq(TaskKind.SEARCH), any(), any())).thenReturn(successfulSearch());
        orchestrator.processDueTasks();

        // When
        TaskView view = orchestrator.cancel(taskId);

        // Then
        assertEquals(TaskState.SUCCESS, view.getState());
        verify(taskRepository, never()).requestCancel(any());
    }

    @Test
    void testProgress_PublishedToSubscribers() {
        // Given
        UUID taskId = orchestrator.submit(searchTask()).getTaskId();
        when(taskDispatcher.dispatch(eq(taskId), eq(TaskKind.SEARCH), any(), any())).thenAnswer(invocation -> {
            invocation.<ProgressReporter>getArgument(3).report(40, "Exported 40 of 100 rows");
            return successfulSearch();
        });

        // When
        orchestrator.processDueTasks();

        // Then
        ArgumentCaptor<TaskEvent> events = ArgumentCaptor.forClass(TaskEvent.class);
        verify(eventPublisher, atLeast(4)).publish(events.capture());
        List<TaskState> states = events.getAllValues().stream().map(TaskEvent::getState).toList();
        assertEquals(List.of(TaskState.PENDING, TaskState.STARTED, TaskState.PROGRESS, TaskState.SUCCESS), states);
        assertEquals(40, events.getAllValues().get(2).getProgress());
        assertNotNull(events.getAllValues().get(3).getResult());
    }

    @Test
    void testPoll_RejectedTaskReturnsToQueue() {
        // Given
        UUID taskId = orchestrator.submit(searchTask()).getTaskId();
        doThrow(new TaskRejectedException("pool full")).when(taskWorkerExecutor).execute(any(Runnable.class));

        // When
        orchestrator.processDueTasks();

        // Then
        assertEquals(TaskState.PENDING, store.get(taskId).getState());
        verify(taskDispatcher, never()).dispatch(any(), any(), any(), any());
    }

    @Test
    void testGetTask_UnknownIdIsNotFound() {
        // When
        ContractsException e = assertThrows(ContractsException.class, () -> orchestrator.getTask(UUID.randomUUID()));

        // Then
        assertEquals(ErrorKind.TASK_NOT_FOUND, e.getKind());
    }

    @Test
    void testGetCachedResult_NotReadyWhenAbsent() {
        assertEquals(CachedTaskResult.NOT_READY, orchestrator.getCachedResult("task-result:search:none").getStatus());
    }

    private TaskRequest searchTask() {
        return TaskRequest.builder()
                .kind(TaskKind.SEARCH)
                .params(JsonMapper.builder().build().createObjectNode().put("page", 1))
                .build();
    }

    private static ContractSearchResponse successfulSearch() {
        return ContractSearchResponse.builder()
                .success(true)
                .data(List.of())
                .pagination(Pagination.of(1, 10, 0))
                .build();
    }
}
