package io.github.riemr.assign.optimization.model;

public record RunConfiguration(
        CriteriaWeights weights,
        Priority priority,
        AssignmentConstraints constraints
) {
    public RunConfiguration {
        weights = weights == null ? CriteriaWeights.DEFAULT : weights;
        priority = priority == null ? Priority.MEDIUM : priority;
        constraints = constraints == null ? AssignmentConstraints.defaults() : constraints;
    }

    public static RunConfiguration defaults() {
        return new RunConfiguration(CriteriaWeights.DEFAULT, Priority.MEDIUM, AssignmentConstraints.defaults());
    }
}
