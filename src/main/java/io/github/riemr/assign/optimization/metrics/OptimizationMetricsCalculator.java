package io.github.riemr.assign.optimization.metrics;

import io.github.riemr.assign.optimization.solution.AssignmentDecision;
import io.github.riemr.assign.optimization.solution.OptimizationMetrics;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.github.riemr.assign.optimization.scoring.AssignmentScorer.round3;

@Component
public class OptimizationMetricsCalculator {

    public OptimizationMetrics calculate(List<AssignmentDecision> assignments) {
        if (assignments == null || assignments.isEmpty()) {
            return OptimizationMetrics.EMPTY;
        }

        double totalScore = assignments.stream().mapToDouble(AssignmentDecision::getAssignmentScore).average().orElse(0);
        double skillUtilization = assignments.stream()
                .mapToDouble(a -> a.getReasoning().getSkillMatchScore()).average().orElse(0);
        double expectedCompletionRate = assignments.stream()
                .mapToDouble(a -> a.getReasoning().getOverallConfidence()).average().orElse(0);

        int[] counts = countsPerStaff(assignments).values().stream().mapToInt(Integer::intValue).toArray();

        return new OptimizationMetrics(
                round3(totalScore),
                round3(skillUtilization),
                round3(workloadBalance(counts)),
                round3(expectedCompletionRate),
                round3(1 - Math.abs(gini(counts))));
    }

    /** 1 件以上割り当てられたスタッフのみ */
    public static Map<String, Integer> countsPerStaff(List<AssignmentDecision> assignments) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (AssignmentDecision a : assignments) {
            counts.merge(a.getAssignedTo(), 1, Integer::sum);
        }
        return counts;
    }

    /** 1 - 標準偏差 / max(1, 平均) */
    static double workloadBalance(int[] counts) {
        double avg = Arrays.stream(counts).average().orElse(0);
        double variance = Arrays.stream(counts).mapToDouble(c -> Math.pow(c - avg, 2)).average().orElse(0);
        return Math.max(0, 1 - Math.sqrt(variance) / Math.max(1, avg));
    }

    static double gini(int[] counts) {
        int[] sorted = counts.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        long total = Arrays.stream(sorted).asLongStream().sum();
        if (n == 0 || total == 0) return 0;
        double sum = 0;
        for (int i = 0; i < n; i++) {
            sum += (2.0 * (i + 1) - n - 1) * sorted[i];
        }
        return sum / (n * (double) total);
    }
}
