package io.github.riemr.assign.optimization.allocation;

import io.github.riemr.assign.optimization.matrix.ScoreMatrix;
import io.github.riemr.assign.optimization.model.AssignmentConstraints;
import io.github.riemr.assign.optimization.model.RunConfiguration;
import io.github.riemr.assign.optimization.solution.AlternativeAssignee;
import io.github.riemr.assign.optimization.solution.AssignmentDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * スコア行列から 1 SOP につき高々 1 名を選ぶ貪欲割当。
 * 最良スコアの高い SOP から順に、公平性で補正したスコアが閾値を超える最上位のスタッフへ割り当てる。
 * 閾値を超える候補がいなければ、その時点で割当件数が最も少ないスタッフへ割り当てる。
 */
@Component
@Slf4j
public class GreedyAllocator {

    static final double ACCEPT_THRESHOLD = 0.4;
    static final int MAX_ALTERNATIVES = 2;

    public List<AssignmentDecision> allocate(ScoreMatrix matrix, RunConfiguration config) {
        AssignmentConstraints constraints = config.constraints();
        int cap = constraints.maxAssignmentsPerPerson();
        double fairnessWeight = config.weights().fairness();

        List<String> sopOrder = new ArrayList<>(matrix.sopIds());
        sopOrder.sort(Comparator.comparingDouble(matrix::bestScore).reversed());

        AllocationState state = new AllocationState();
        for (String sopId : sopOrder) {
            List<AssignmentDecision> ranked = new ArrayList<>(matrix.row(sopId));
            ranked.sort(Comparator.comparingDouble(AssignmentDecision::getAssignmentScore).reversed());

            AssignmentDecision chosen = null;
            for (AssignmentDecision candidate : ranked) {
                String staffId = candidate.getAssignedTo();
                if (state.isSaturated(staffId, cap)) continue;
                if (constraints.isExcluded(staffId)) continue;

                double adjusted = candidate.getAssignmentScore() * fairnessMultiplier(staffId, state, fairnessWeight);
                if (adjusted > ACCEPT_THRESHOLD) {
                    chosen = candidate;
                    break;
                }
            }

            if (chosen == null) {
                chosen = leastLoaded(ranked, state, constraints);
                if (chosen != null && state.isSaturated(chosen.getAssignedTo(), cap)) {
                    chosen = null;
                }
                if (chosen != null) {
                    log.debug("SOP {} fell back to least loaded staff {}", sopId, chosen.getAssignedTo());
                }
            }

            if (chosen == null) {
                log.debug("SOP {} left unassigned (all candidates at cap {})", sopId, cap);
                continue;
            }
            state.accept(chosen.toBuilder()
                    .alternativeAssignees(alternatives(chosen, ranked, state, constraints))
                    .build());
        }

        log.info("Greedy allocation assigned {} of {} SOPs", state.accepted().size(), sopOrder.size());
        return List.copyOf(state.accepted());
    }

    /**
     * 平均より多く割り当てられているスタッフほどスコアを割り引く。fairnessWeight が 0 なら補正なし。
     */
    double fairnessMultiplier(String staffId, AllocationState state, double fairnessWeight) {
        if (fairnessWeight == 0) return 1.0;
        double avg = state.averageCount();
        double fairness = Math.max(0.3, 1 - Math.max(0, state.countOf(staffId) - avg) * 0.3);
        return 1 - fairnessWeight + fairnessWeight * fairness;
    }

    /** 件数が同じなら並び順で先のスタッフ */
    private AssignmentDecision leastLoaded(List<AssignmentDecision> ranked, AllocationState state,
                                           AssignmentConstraints constraints) {
        AssignmentDecision min = null;
        for (AssignmentDecision d : ranked) {
            if (constraints.isExcluded(d.getAssignedTo())) continue;
            if (min == null || state.countOf(d.getAssignedTo()) < state.countOf(min.getAssignedTo())) {
                min = d;
            }
        }
        return min;
    }

    private List<AlternativeAssignee> alternatives(AssignmentDecision chosen, List<AssignmentDecision> ranked,
                                                   AllocationState state, AssignmentConstraints constraints) {
        int cap = constraints.maxAssignmentsPerPerson();
        return ranked.stream()
                .filter(d -> !d.getAssignedTo().equals(chosen.getAssignedTo()))
                .filter(d -> !constraints.isExcluded(d.getAssignedTo()))
                .filter(d -> !state.isSaturated(d.getAssignedTo(), cap))
                .limit(MAX_ALTERNATIVES)
                .map(d -> new AlternativeAssignee(
                        d.getAssignedTo(),
                        d.getAssignmentScore(),
                        d.getReasoning().leadingFactor() != null ? d.getReasoning().leadingFactor() : "Alternative option"))
                .toList();
    }
}
