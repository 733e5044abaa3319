package io.github.riemr.assign.optimization.solution;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AssignmentReasoning {
    double skillMatchScore;
    double availabilityScore;
    double workloadScore;
    double performanceScore;
    /** min(0.95, 総合スコア) */
    double overallConfidence;
    List<String> keyFactors;

    public String leadingFactor() {
        return keyFactors == null || keyFactors.isEmpty() ? null : keyFactors.get(0);
    }
}
