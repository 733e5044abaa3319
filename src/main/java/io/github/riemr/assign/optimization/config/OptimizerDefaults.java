package io.github.riemr.assign.optimization.config;

import io.github.riemr.assign.optimization.model.CriteriaWeights;
import io.github.riemr.assign.optimization.model.Priority;

/**
 * リクエストで省略された項目に使う既定値。
 */
public record OptimizerDefaults(
        CriteriaWeights weights,
        int maxAssignmentsPerPerson,
        Priority priority
) {
}
