package io.github.riemr.assign.optimization.model;

import java.util.Set;

/**
 * 最適化 1 回分の制約。excludeUsers は絶対条件で、mustIncludeUsers より優先される。
 */
public record AssignmentConstraints(
        int maxAssignmentsPerPerson,
        Set<StaffRole> requiredRoles,
        Set<String> excludeUsers,
        Set<String> mustIncludeUsers
) {
    public static final int DEFAULT_MAX_ASSIGNMENTS_PER_PERSON = 3;

    public AssignmentConstraints {
        if (maxAssignmentsPerPerson < 1) {
            throw new IllegalArgumentException("maxAssignmentsPerPerson must be >= 1");
        }
        requiredRoles = requiredRoles == null ? Set.of() : Set.copyOf(requiredRoles);
        excludeUsers = excludeUsers == null ? Set.of() : Set.copyOf(excludeUsers);
        mustIncludeUsers = mustIncludeUsers == null ? Set.of() : Set.copyOf(mustIncludeUsers);
    }

    public static AssignmentConstraints defaults() {
        return new AssignmentConstraints(DEFAULT_MAX_ASSIGNMENTS_PER_PERSON, Set.of(), Set.of(), Set.of());
    }

    public boolean isExcluded(String candidateId) {
        return candidateId != null && excludeUsers.contains(candidateId);
    }

    /**
     * 職種・除外リストで候補者を絞り込む。mustInclude の候補は職種条件を無視する。
     */
    public boolean isEligible(Candidate candidate) {
        if (isExcluded(candidate.getId())) return false;
        if (candidate.getId() != null && mustIncludeUsers.contains(candidate.getId())) return true;
        if (requiredRoles.isEmpty()) return true;
        // Set.of 系は contains(null) で NPE になる
        return candidate.getRole() != null && requiredRoles.contains(candidate.getRole());
    }
}
