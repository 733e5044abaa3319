package io.github.riemr.assign.optimization.solution;

import java.util.List;

public record OptimizationResult(
        List<AssignmentDecision> assignments,
        OptimizationMetrics metrics,
        List<String> recommendations,
        List<String> warnings
) {
}
