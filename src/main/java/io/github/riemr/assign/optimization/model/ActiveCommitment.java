package io.github.riemr.assign.optimization.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 既に割り当て済みの SOP。status が PENDING / IN_PROGRESS のものだけが負荷として数えられる。
 */
@Value
@Builder
public class ActiveCommitment {
    String assignmentId;
    String sopId;
    /** null の場合は既定 30 分として扱う */
    Integer estimatedMinutes;
    LocalDateTime dueDate;
    Priority priority;
    CommitmentStatus status;

    public boolean isActive() {
        return status != null && status.isActive();
    }

    public boolean isOverdue(LocalDateTime now) {
        return isActive() && dueDate != null && dueDate.isBefore(now);
    }
}
