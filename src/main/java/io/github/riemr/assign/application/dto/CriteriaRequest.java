package io.github.riemr.assign.application.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.github.riemr.assign.optimization.model.CriteriaWeights;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;

/**
 * 評価基準の重み。省略した項目は既定値。
 * 指定された skill / availability / workload / performance の合計は 1 以下。
 */
@Data
public class CriteriaRequest {
    @DecimalMin("0.0") @DecimalMax("1.0")
    private Double skillWeight;
    @DecimalMin("0.0") @DecimalMax("1.0")
    private Double availabilityWeight;
    @DecimalMin("0.0") @DecimalMax("1.0")
    private Double workloadWeight;
    @DecimalMin("0.0") @DecimalMax("1.0")
    private Double performanceWeight;
    @DecimalMin("0.0") @DecimalMax("1.0")
    private Double fairnessWeight;

    @JsonIgnore
    @AssertTrue(message = "skill, availability, workload and performance weights must not sum to more than 1")
    public boolean isScoringWeightSumValid() {
        double sum = CriteriaWeights.scoringSum(orZero(skillWeight), orZero(availabilityWeight),
                orZero(workloadWeight), orZero(performanceWeight));
        return sum <= 1 + CriteriaWeights.SUM_TOLERANCE;
    }

    private static double orZero(Double weight) {
        return weight == null ? 0 : weight;
    }
}
