package io.github.riemr.assign.optimization.solution;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * SOP 1 件に対する割当結果。スコア行列の各セルもこの形で保持し、
 * 採用時に toBuilder で代替候補を付けた新しいインスタンスを作る。
 */
@Value
@Builder(toBuilder = true)
public class AssignmentDecision {
    String sopId;
    String assignedTo;
    double assignmentScore;
    AssignmentReasoning reasoning;
    int estimatedCompletionMinutes;
    LocalDateTime recommendedDueDate;
    @Builder.Default
    List<AlternativeAssignee> alternativeAssignees = List.of();
}
