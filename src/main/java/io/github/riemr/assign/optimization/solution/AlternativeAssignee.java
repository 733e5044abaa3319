package io.github.riemr.assign.optimization.solution;

public record AlternativeAssignee(String userId, double score, String reason) {
}
