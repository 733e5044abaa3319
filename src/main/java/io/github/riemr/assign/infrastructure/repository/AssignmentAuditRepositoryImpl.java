package io.github.riemr.assign.infrastructure.repository;

import io.github.riemr.assign.application.repository.AssignmentAuditRepository;
import io.github.riemr.assign.infrastructure.mapper.AssignmentAuditLogMapper;
import io.github.riemr.assign.infrastructure.persistence.entity.AssignmentAuditLog;
import org.springframework.stereotype.Repository;

@Repository
public class AssignmentAuditRepositoryImpl implements AssignmentAuditRepository {

    private final AssignmentAuditLogMapper mapper;

    public AssignmentAuditRepositoryImpl(AssignmentAuditLogMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void record(AssignmentAuditLog entry) {
        mapper.insert(entry);
    }
}
