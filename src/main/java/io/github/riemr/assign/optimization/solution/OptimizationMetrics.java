package io.github.riemr.assign.optimization.solution;

public record OptimizationMetrics(
        double totalScore,
        double skillUtilization,
        double workloadBalance,
        double expectedCompletionRate,
        double fairnessIndex
) {
    public static final OptimizationMetrics EMPTY = new OptimizationMetrics(0, 0, 0, 0, 0);
}
