package io.github.riemr.assign.optimization.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 過去の SOP 進捗履歴 1 件。
 */
@Value
@Builder
public class CompletionRecord {
    Difficulty difficulty;
    /** 0..100 */
    int progressPercentage;
    int timeSpentMinutes;
    LocalDateTime lastAccessed;

    public boolean isFullyCompleted() {
        return progressPercentage == 100;
    }
}
