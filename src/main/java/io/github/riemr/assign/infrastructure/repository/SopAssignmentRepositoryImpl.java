package io.github.riemr.assign.infrastructure.repository;

import io.github.riemr.assign.application.repository.SopAssignmentRepository;
import io.github.riemr.assign.infrastructure.mapper.SopAssignmentMapper;
import io.github.riemr.assign.infrastructure.persistence.entity.SopAssignment;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class SopAssignmentRepositoryImpl implements SopAssignmentRepository {

    private final SopAssignmentMapper mapper;

    public SopAssignmentRepositoryImpl(SopAssignmentMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void save(SopAssignment assignment) {
        mapper.insert(assignment);
    }

    @Override
    public void updateAssignee(SopAssignment assignment) {
        mapper.updateAssignee(assignment);
    }

    @Override
    public List<SopAssignment> findOptimizable(String restaurantId, List<String> assignmentIds) {
        if (assignmentIds == null || assignmentIds.isEmpty()) {
            return List.of();
        }
        return mapper.selectOptimizable(restaurantId, assignmentIds);
    }
}
