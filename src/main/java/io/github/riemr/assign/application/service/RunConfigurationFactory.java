package io.github.riemr.assign.application.service;

import io.github.riemr.assign.application.dto.ConstraintsRequest;
import io.github.riemr.assign.application.dto.CriteriaRequest;
import io.github.riemr.assign.optimization.config.OptimizerDefaults;
import io.github.riemr.assign.optimization.model.AssignmentConstraints;
import io.github.riemr.assign.optimization.model.CriteriaWeights;
import io.github.riemr.assign.optimization.model.Priority;
import io.github.riemr.assign.optimization.model.RunConfiguration;
import io.github.riemr.assign.optimization.model.StaffRole;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * リクエストの重み・優先度・制約を既定値で補完して RunConfiguration にする。
 */
@Component
@RequiredArgsConstructor
public class RunConfigurationFactory {

    private final OptimizerDefaults defaults;

    public RunConfiguration create(CriteriaRequest criteria, String priority, ConstraintsRequest constraints) {
        return new RunConfiguration(toWeights(criteria), toPriority(priority), toConstraints(constraints));
    }

    private CriteriaWeights toWeights(CriteriaRequest c) {
        if (c == null) return defaults.weights();
        return CriteriaWeights.of(c.getSkillWeight(), c.getAvailabilityWeight(), c.getWorkloadWeight(),
                c.getPerformanceWeight(), c.getFairnessWeight(), defaults.weights());
    }

    private Priority toPriority(String code) {
        Priority p = Priority.fromCode(code);
        return p != null ? p : defaults.priority();
    }

    private AssignmentConstraints toConstraints(ConstraintsRequest c) {
        if (c == null) {
            return new AssignmentConstraints(defaults.maxAssignmentsPerPerson(), Set.of(), Set.of(), Set.of());
        }
        Set<StaffRole> roles = new HashSet<>();
        for (String code : nonNull(c.getRequiredRoles())) {
            StaffRole role = StaffRole.fromCode(code);
            if (role == null) {
                throw new IllegalArgumentException("unknown role: " + code);
            }
            roles.add(role);
        }
        int max = c.getMaxAssignmentsPerPerson() != null ? c.getMaxAssignmentsPerPerson() : defaults.maxAssignmentsPerPerson();
        return new AssignmentConstraints(max, roles,
                new HashSet<>(nonNull(c.getExcludeUsers())),
                new HashSet<>(nonNull(c.getMustIncludeUsers())));
    }

    private static List<String> nonNull(List<String> list) {
        return Optional.ofNullable(list).orElse(List.of()).stream().filter(s -> s != null && !s.isBlank()).toList();
    }
}
