package com.govcontracts.infrastructure.persistence.entity;

import com.govcontracts.domain.model.TaskKind;
import com.govcontracts.domain.model.TaskState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Entity for tracking background tasks.
 *
 * Heavy queries and file exports run as tasks. Clients poll this record or
 * subscribe to its events; the terminal result is also cached under
 * {@code cacheKey}.
 *
 * {@code cancelRequested} is only ever set by {@link
 * com.govcontracts.infrastructure.persistence.repository.TaskRepository#requestCancel}.
 * Writes that race with it (claim, progress, retry) go through targeted
 * updates so a stale copy of this entity cannot clear the flag.
 */
@Entity
@Table(name = "contract_tasks", indexes = {
    @Index(name = "idx_task_state_next_attempt", columnList = "state, nextAttemptAt"),
    @Index(name = "idx_task_cache_key", columnList = "cacheKey"),
    @Index(name = "idx_task_created_at", columnList = "createdAt")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TaskEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID taskId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private TaskKind kind;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String params;

    @Column(nullable = false, length = 100)
    private String cacheKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private TaskState state = TaskState.PENDING;

    @Column(nullable = false)
    private int progress;

    @Column(length = 500)
    private String statusMessage;

    @Column(columnDefinition = "TEXT")
    private String result;

    @Column(length = 1000)
    private String errorMessage;

    @Column(nullable = false)
    private int retryCount;

    @Column(nullable = false)
    private int maxRetries;

    @Column(nullable = false)
    private boolean cancelRequested;

    @Column
    private Instant nextAttemptAt;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant startedAt;

    @Column
    private Instant completedAt;

    @PrePersist
    protected void onCreate() {
        if (taskId == null) {
            taskId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (nextAttemptAt == null) {
            nextAttemptAt = createdAt;
        }
    }

    public void markStarted() {
        this.state = TaskState.STARTED;
        this.statusMessage = "Started";
        this.startedAt = Instant.now();
    }

    public void markProgress(int progress, String statusMessage) {
        this.state = TaskState.PROGRESS;
        this.progress = Math.max(0, Math.min(100, progress));
        this.statusMessage = statusMessage;
    }

    public void markSucceeded(String result) {
        this.state = TaskState.SUCCESS;
        this.progress = 100;
        this.statusMessage = "Completed";
        this.result = result;
        this.errorMessage = null;
        this.completedAt = Instant.now();
    }

    public void markRetry(String error, Instant nextAttemptAt) {
        this.state = TaskState.RETRY;
        this.retryCount++;
        this.statusMessage = "Retry " + retryCount + " of " + maxRetries;
        this.errorMessage = truncate(error);
        this.nextAttemptAt = nextAttemptAt;
    }

    public void markFailed(String error) {
        this.state = TaskState.FAILURE;
        this.statusMessage = "Failed";
        this.errorMessage = truncate(error);
        this.completedAt = Instant.now();
    }

    public boolean hasRetriesLeft() {
        return retryCount < maxRetries;
    }

    public long getExecutionTimeMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= 1000) {
            return error;
        }
        return error.substring(0, 1000);
    }
}
