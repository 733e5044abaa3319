package io.github.riemr.assign.optimization.allocation;

import io.github.riemr.assign.optimization.solution.AssignmentDecision;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 1 回の割当処理の間だけ使う累積状態。スタッフごとの割当件数と確定済みの結果を持つ。
 * インスタンスは実行ごとに生成し、実行間で共有しない。
 */
final class AllocationState {
    private final Map<String, Integer> counts = new LinkedHashMap<>();
    private final List<AssignmentDecision> accepted = new ArrayList<>();

    int countOf(String staffId) {
        return counts.getOrDefault(staffId, 0);
    }

    boolean isSaturated(String staffId, int cap) {
        return countOf(staffId) >= cap;
    }

    /** 割当済みのスタッフのみを母数とした平均件数 */
    double averageCount() {
        if (counts.isEmpty()) return 0;
        return counts.values().stream().mapToInt(Integer::intValue).average().orElse(0);
    }

    void accept(AssignmentDecision decision) {
        accepted.add(decision);
        counts.merge(decision.getAssignedTo(), 1, Integer::sum);
    }

    List<AssignmentDecision> accepted() {
        return Collections.unmodifiableList(accepted);
    }
}
