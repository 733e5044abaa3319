package io.github.riemr.assign.optimization.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CriteriaWeightsTest {

    @Test
    void scoringWeightsAboveOne_areRejected() {
        assertThatThrownBy(() -> new CriteriaWeights(1, 1, 1, 1, 0.2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("skill, availability, workload and performance weights must not sum to more than 1");
        assertThatThrownBy(() -> new CriteriaWeights(0.5, 0.5, 0.01, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sumOfExactlyOne_isAccepted_andFairnessIsNotCounted() {
        assertThatCode(() -> new CriteriaWeights(0.1, 0.2, 0.3, 0.4, 1.0)).doesNotThrowAnyException();
        assertThatCode(() -> new CriteriaWeights(0, 0, 0, 0, 0)).doesNotThrowAnyException();
        assertThat(CriteriaWeights.scoringSum(
                CriteriaWeights.DEFAULT.skill(), CriteriaWeights.DEFAULT.availability(),
                CriteriaWeights.DEFAULT.workload(), CriteriaWeights.DEFAULT.performance())).isLessThanOrEqualTo(1.0 + 1e-9);
    }

    @Test
    void singleWeightOutsideUnitRange_isRejected() {
        assertThatThrownBy(() -> new CriteriaWeights(-0.1, 0, 0, 0, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("skill weight must be between 0 and 1");
        assertThatThrownBy(() -> new CriteriaWeights(0, 0, 0, 0, 1.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("fairness weight must be between 0 and 1");
        assertThatThrownBy(() -> new CriteriaWeights(Double.NaN, 0, 0, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void of_fillsMissingWeightsFromDefaults_beforeCheckingTheSum() {
        CriteriaWeights w = CriteriaWeights.of(0.0, null, null, null, null, CriteriaWeights.DEFAULT);
        assertThat(w).isEqualTo(new CriteriaWeights(0.0, 0.25, 0.2, 0.25, 0.2));

        assertThatThrownBy(() -> CriteriaWeights.of(0.9, null, null, null, null, CriteriaWeights.DEFAULT))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
