package io.github.riemr.assign.optimization.matrix;

import io.github.riemr.assign.optimization.solution.AssignmentDecision;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * sopId → (staffId → 評価結果) の行列。挿入順（入力順）を保持する。
 */
public class ScoreMatrix {
    private final Map<String, Map<String, AssignmentDecision>> cells = new LinkedHashMap<>();

    void put(String sopId, String staffId, AssignmentDecision decision) {
        cells.computeIfAbsent(sopId, k -> new LinkedHashMap<>()).put(staffId, decision);
    }

    public Set<String> sopIds() {
        return Collections.unmodifiableSet(cells.keySet());
    }

    /** 候補者の入力順 */
    public List<AssignmentDecision> row(String sopId) {
        return List.copyOf(cells.getOrDefault(sopId, Map.of()).values());
    }

    public double bestScore(String sopId) {
        return cells.getOrDefault(sopId, Map.of()).values().stream()
                .mapToDouble(AssignmentDecision::getAssignmentScore)
                .max()
                .orElse(Double.NEGATIVE_INFINITY);
    }
}
