package io.github.riemr.assign.optimization.matrix;

import io.github.riemr.assign.optimization.InvalidAssignmentInputException;
import io.github.riemr.assign.optimization.model.Candidate;
import io.github.riemr.assign.optimization.model.RunConfiguration;
import io.github.riemr.assign.optimization.model.SopTask;
import io.github.riemr.assign.optimization.scoring.AssignmentScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class ScoreMatrixBuilder {

    private final AssignmentScorer scorer;

    /**
     * 全 SOP × 全候補者を評価する。候補者は制約で絞り込み済みであること。
     */
    public ScoreMatrix build(List<SopTask> tasks, List<Candidate> candidates, RunConfiguration config) {
        if (tasks == null || tasks.isEmpty()) {
            throw new InvalidAssignmentInputException("No valid SOPs found for assignment");
        }
        if (candidates == null || candidates.isEmpty()) {
            throw new InvalidAssignmentInputException("No available staff found for assignment");
        }

        ScoreMatrix matrix = new ScoreMatrix();
        for (SopTask task : tasks) {
            for (Candidate candidate : candidates) {
                matrix.put(task.getId(), candidate.getId(),
                        scorer.score(task, candidate, config.weights(), config.priority()));
            }
        }
        log.debug("Score matrix built: {} SOPs x {} staff", tasks.size(), candidates.size());
        return matrix;
    }
}
