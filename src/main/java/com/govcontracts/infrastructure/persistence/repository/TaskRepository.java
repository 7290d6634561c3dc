package com.govcontracts.infrastructure.persistence.repository;

import com.govcontracts.domain.model.TaskState;
import com.govcontracts.infrastructure.persistence.entity.TaskEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface TaskRepository extends JpaRepository<TaskEntity, UUID> {

    List<TaskEntity> findTop10ByStateInAndNextAttemptAtLessThanEqualOrderByCreatedAtAsc(
            Collection<TaskState> states, Instant now);

    @Modifying
    @Transactional
    @Query("update TaskEntity t set t.cancelRequested = true where t.taskId = :taskId")
    int requestCancel(@Param("taskId") UUID taskId);

    /**
     * Move a task to STARTED only if it is still in one of {@code from}.
     * Returns 0 when another writer got there first.
     */
    @Modifying
    @Transactional
    @Query("update TaskEntity t set t.state = :state, t.statusMessage = :statusMessage, t.startedAt = :startedAt "
            + "where t.taskId = :taskId and t.state in :from")
    int claim(@Param("taskId") UUID taskId, @Param("from") Collection<TaskState> from,
              @Param("state") TaskState state, @Param("statusMessage") String statusMessage,
              @Param("startedAt") Instant startedAt);

    @Modifying
    @Transactional
    @Query("update TaskEntity t set t.state = :to where t.taskId = :taskId and t.state = :from")
    int release(@Param("taskId") UUID taskId, @Param("from") TaskState from, @Param("to") TaskState to);

    /**
     * Record progress of a running task. Leaves {@code cancelRequested} alone.
     */
    @Modifying
    @Transactional
    @Query("update TaskEntity t set t.state = :state, t.progress = :progress, t.statusMessage = :statusMessage "
            + "where t.taskId = :taskId and t.state in :running")
    int updateProgress(@Param("taskId") UUID taskId, @Param("running") Collection<TaskState> running,
                       @Param("state") TaskState state, @Param("progress") int progress,
                       @Param("statusMessage") String statusMessage);

    /**
     * Schedule another attempt unless a cancel was requested meanwhile.
     */
    @Modifying
    @Transactional
    @Query("update TaskEntity t set t.state = :state, t.retryCount = t.retryCount + 1, "
            + "t.statusMessage = :statusMessage, t.errorMessage = :errorMessage, t.nextAttemptAt = :nextAttemptAt "
            + "where t.taskId = :taskId and t.cancelRequested = false")
    int scheduleRetry(@Param("taskId") UUID taskId, @Param("state") TaskState state,
                      @Param("statusMessage") String statusMessage, @Param("errorMessage") String errorMessage,
                      @Param("nextAttemptAt") Instant nextAttemptAt);
}
