package io.github.riemr.assign.optimization.service;

import io.github.riemr.assign.optimization.allocation.GreedyAllocator;
import io.github.riemr.assign.optimization.matrix.ScoreMatrix;
import io.github.riemr.assign.optimization.matrix.ScoreMatrixBuilder;
import io.github.riemr.assign.optimization.metrics.AssignmentAdvisor;
import io.github.riemr.assign.optimization.metrics.OptimizationMetricsCalculator;
import io.github.riemr.assign.optimization.model.Candidate;
import io.github.riemr.assign.optimization.model.RunConfiguration;
import io.github.riemr.assign.optimization.model.SopTask;
import io.github.riemr.assign.optimization.solution.AssignmentDecision;
import io.github.riemr.assign.optimization.solution.OptimizationMetrics;
import io.github.riemr.assign.optimization.solution.OptimizationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * SOP 割当最適化の入口。
 * 入出力はメモリ上のスナップショットのみで、I/O や実行間で共有する状態を持たない。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssignmentOptimizer {

    private final ScoreMatrixBuilder matrixBuilder;
    private final GreedyAllocator allocator;
    private final OptimizationMetricsCalculator metricsCalculator;
    private final AssignmentAdvisor advisor;

    public OptimizationResult optimize(List<SopTask> tasks, List<Candidate> candidates, RunConfiguration config) {
        RunConfiguration run = config == null ? RunConfiguration.defaults() : config;
        List<SopTask> sops = Optional.ofNullable(tasks).orElse(List.of());
        List<Candidate> staff = Optional.ofNullable(candidates).orElse(List.of()).stream()
                .filter(run.constraints()::isEligible)
                .toList();

        ScoreMatrix matrix = matrixBuilder.build(sops, staff, run);
        List<AssignmentDecision> assignments = allocator.allocate(matrix, run);

        OptimizationMetrics metrics = metricsCalculator.calculate(assignments);
        List<String> recommendations = advisor.recommendations(assignments, metrics);
        List<String> warnings = advisor.warnings(assignments, staff, sops);

        log.info("Optimized {} SOPs over {} staff: assigned={}, totalScore={}, warnings={}",
                sops.size(), staff.size(), assignments.size(), metrics.totalScore(), warnings.size());
        return new OptimizationResult(assignments, metrics, recommendations, warnings);
    }
}
