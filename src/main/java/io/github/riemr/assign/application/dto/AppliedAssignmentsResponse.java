package io.github.riemr.assign.application.dto;

import io.github.riemr.assign.optimization.solution.OptimizationMetrics;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 最適化結果を登録・更新した後のレスポンス。
 */
@Value
@Builder
public class AppliedAssignmentsResponse {
    List<SopAssignmentView> assignments;
    OptimizationMetrics optimizationSummary;
    List<String> recommendations;
    List<String> warnings;
}
