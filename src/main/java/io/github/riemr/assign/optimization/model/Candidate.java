package io.github.riemr.assign.optimization.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * 割当候補のスタッフ。データ取得側でスキル・現在の割当・進捗履歴まで展開済みであること。
 */
@Value
@Builder
public class Candidate {
    String id;
    String fullName;
    StaffRole role;
    List<StaffSkill> skills;
    List<ActiveCommitment> commitments;
    List<CompletionRecord> history;

    public List<StaffSkill> skillList() {
        return Optional.ofNullable(skills).orElse(List.of());
    }

    /** PENDING / IN_PROGRESS の割当のみ */
    public List<ActiveCommitment> activeCommitments() {
        return Optional.ofNullable(commitments).orElse(List.of()).stream()
                .filter(ActiveCommitment::isActive)
                .toList();
    }

    public List<CompletionRecord> historyList() {
        return Optional.ofNullable(history).orElse(List.of());
    }
}
