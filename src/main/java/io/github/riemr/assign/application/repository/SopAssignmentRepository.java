package io.github.riemr.assign.application.repository;

import io.github.riemr.assign.infrastructure.persistence.entity.SopAssignment;

import java.util.List;

public interface SopAssignmentRepository {
    void save(SopAssignment assignment);

    void updateAssignee(SopAssignment assignment);

    /** pending / in_progress のものだけ */
    List<SopAssignment> findOptimizable(String restaurantId, List<String> assignmentIds);
}
