package io.github.riemr.assign.application.repository;

import io.github.riemr.assign.optimization.model.AssignmentConstraints;
import io.github.riemr.assign.optimization.model.Candidate;

import java.util.List;

/**
 * 割当候補の取得。スキル・現在の割当・進捗履歴まで展開した Candidate を返す。
 */
public interface StaffCandidateRepository {
    /** 店舗内の有効なスタッフを職種・除外条件で絞り込んで返す */
    List<Candidate> findCandidates(String restaurantId, AssignmentConstraints constraints);
}
