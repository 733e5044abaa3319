package io.github.riemr.assign.application.repository;

import io.github.riemr.assign.infrastructure.persistence.entity.AssignmentAuditLog;

public interface AssignmentAuditRepository {
    void record(AssignmentAuditLog entry);
}
