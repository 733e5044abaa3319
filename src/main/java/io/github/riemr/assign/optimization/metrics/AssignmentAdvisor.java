package io.github.riemr.assign.optimization.metrics;

import io.github.riemr.assign.optimization.model.Candidate;
import io.github.riemr.assign.optimization.model.SopTask;
import io.github.riemr.assign.optimization.solution.AssignmentDecision;
import io.github.riemr.assign.optimization.solution.OptimizationMetrics;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 割当結果から改善提案と警告を組み立てる。
 */
@Component
public class AssignmentAdvisor {

    static final int OVERLOAD_THRESHOLD = 4;
    static final double LOW_CONFIDENCE_SCORE = 0.4;

    public List<String> recommendations(List<AssignmentDecision> assignments, OptimizationMetrics metrics) {
        List<String> list = new ArrayList<>();
        if (metrics.skillUtilization() < 0.6) {
            list.add("Consider providing additional training to improve skill matching");
        }
        if (metrics.workloadBalance() < 0.7) {
            list.add("Workload distribution could be more balanced across team members");
        }
        if (metrics.expectedCompletionRate() < 0.8) {
            list.add("Some assignments may need additional support or extended deadlines");
        }
        if (assignments.stream().anyMatch(a -> a.getAssignmentScore() < 0.5)) {
            list.add("Some SOPs may require reassignment or additional training resources");
        }
        if (metrics.fairnessIndex() < 0.8) {
            list.add("Consider redistributing assignments to improve fairness");
        }
        return list;
    }

    public List<String> warnings(List<AssignmentDecision> assignments, List<Candidate> staff, List<SopTask> tasks) {
        List<String> list = new ArrayList<>();

        Map<String, Candidate> staffById = staff.stream()
                .collect(Collectors.toMap(Candidate::getId, Function.identity(), (a, b) -> a));
        OptimizationMetricsCalculator.countsPerStaff(assignments).forEach((staffId, count) -> {
            if (count > OVERLOAD_THRESHOLD) {
                Candidate c = staffById.get(staffId);
                String name = c != null && c.getFullName() != null ? c.getFullName() : "Staff member";
                list.add(name + " assigned " + count + " SOPs - may be overloaded");
            }
        });

        long lowConfidence = assignments.stream().filter(a -> a.getAssignmentScore() < LOW_CONFIDENCE_SCORE).count();
        if (lowConfidence > 0) {
            list.add(lowConfidence + " assignments have low confidence scores");
        }

        Set<String> assigned = assignments.stream().map(AssignmentDecision::getSopId).collect(Collectors.toSet());
        long unassigned = tasks.stream().filter(t -> !assigned.contains(t.getId())).count();
        if (unassigned > 0) {
            list.add(unassigned + " SOPs could not be assigned optimally");
        }
        return list;
    }
}
