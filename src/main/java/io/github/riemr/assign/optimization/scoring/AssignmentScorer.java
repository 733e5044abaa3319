package io.github.riemr.assign.optimization.scoring;

import io.github.riemr.assign.optimization.model.ActiveCommitment;
import io.github.riemr.assign.optimization.model.Candidate;
import io.github.riemr.assign.optimization.model.CompletionRecord;
import io.github.riemr.assign.optimization.model.CriteriaWeights;
import io.github.riemr.assign.optimization.model.Difficulty;
import io.github.riemr.assign.optimization.model.Priority;
import io.github.riemr.assign.optimization.model.SopTask;
import io.github.riemr.assign.optimization.model.StaffRole;
import io.github.riemr.assign.optimization.model.StaffSkill;
import io.github.riemr.assign.optimization.solution.AssignmentDecision;
import io.github.riemr.assign.optimization.solution.AssignmentReasoning;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * SOP とスタッフの組み合わせ 1 件を評価する。
 * スキル・空き状況・負荷・実績の 4 つの部分スコア（0..1）を算出し、
 * 重み付き合計を総合スコアとする。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AssignmentScorer {

    static final int DEFAULT_TASK_MINUTES = 30;
    static final int IDEAL_WORKLOAD_MINUTES = 180; // 1 日 3 時間
    static final int RECENT_WINDOW_DAYS = 30;
    static final int MIN_ESTIMATED_MINUTES = 10;

    private final Clock clock;

    public AssignmentDecision score(SopTask task, Candidate candidate, CriteriaWeights weights, Priority priority) {
        LocalDateTime now = LocalDateTime.now(clock);

        double skill = skillMatchScore(task, candidate);
        double availability = availabilityScore(candidate, now);
        double workload = workloadScore(candidate);
        double performance = performanceScore(candidate, now);

        double overall = skill * weights.skill()
                + availability * weights.availability()
                + workload * weights.workload()
                + performance * weights.performance();

        Map<String, Double> factors = new LinkedHashMap<>();
        factors.put("skill", skill);
        factors.put("availability", availability);
        factors.put("workload", workload);
        factors.put("performance", performance);

        double estimated = estimateCompletionMinutes(task, candidate);
        LocalDateTime dueDate = recommendedDueDate(now, estimated, priority);

        if (log.isTraceEnabled()) {
            log.trace("score sop={} staff={} skill={} avail={} load={} perf={} overall={}",
                    task.getId(), candidate.getId(), skill, availability, workload, performance, overall);
        }

        return AssignmentDecision.builder()
                .sopId(task.getId())
                .assignedTo(candidate.getId())
                .assignmentScore(round3(overall))
                .reasoning(AssignmentReasoning.builder()
                        .skillMatchScore(round3(skill))
                        .availabilityScore(round3(availability))
                        .workloadScore(round3(workload))
                        .performanceScore(round3(performance))
                        .overallConfidence(Math.min(0.95, overall))
                        .keyFactors(keyFactors(factors))
                        .build())
                .estimatedCompletionMinutes((int) Math.round(estimated))
                .recommendedDueDate(dueDate)
                .build();
    }

    double skillMatchScore(SopTask task, Candidate candidate) {
        List<String> tags = task.normalizedTags();
        String category = task.normalizedCategory();

        double score = 0.5;
        score += roleSkillMatch(candidate.getRole(), category, tags) * 0.4;

        List<StaffSkill> relevant = candidate.skillList().stream()
                .filter(s -> isRelevant(s, category, tags))
                .toList();
        if (!relevant.isEmpty()) {
            double avgLevel = relevant.stream().mapToInt(StaffSkill::getProficiencyLevel).average().orElse(0);
            int required = Difficulty.targetProficiencyOf(task.getDifficulty());
            double levelMatch = 1 - Math.abs(avgLevel - required) / 10.0;
            score += Math.max(0, levelMatch) * 0.4;
        }

        score += experienceMatch(task, candidate) * 0.2;
        return clamp(score, 0, 1);
    }

    double roleSkillMatch(StaffRole role, String category, List<String> tags) {
        if (role == null) return 0;
        if (role.coversAllCategories()) return 0.8;
        List<String> keywords = role.getKeywords();
        long matchCount = keywords.stream()
                .filter(k -> category.contains(k) || tags.stream().anyMatch(t -> t.contains(k)))
                .count();
        return Math.min(1, (double) matchCount / Math.max(1, keywords.size())) * 0.8;
    }

    private boolean isRelevant(StaffSkill skill, String category, List<String> tags) {
        String name = skill.getSkillName() == null ? "" : skill.getSkillName().toLowerCase(Locale.ROOT);
        if (!name.isEmpty() && tags.stream().anyMatch(t -> t.contains(name))) return true;
        // 空カテゴリは全スキルに一致してしまうため対象外
        if (category.isEmpty() || skill.getSkillCategory() == null) return false;
        return skill.getSkillCategory().toLowerCase(Locale.ROOT).contains(category);
    }

    double experienceMatch(SopTask task, Candidate candidate) {
        List<CompletionRecord> relevant = candidate.historyList().stream()
                .filter(h -> Objects.equals(h.getDifficulty(), task.getDifficulty()))
                .toList();
        if (relevant.isEmpty()) return 0.3;
        long completed = relevant.stream().filter(CompletionRecord::isFullyCompleted).count();
        double completionRate = (double) completed / relevant.size();
        return Math.min(1, completionRate + relevant.size() * 0.05);
    }

    double availabilityScore(Candidate candidate, LocalDateTime now) {
        List<ActiveCommitment> active = candidate.activeCommitments();
        double score = 1.0;
        score -= Math.min(0.8, active.size() * 0.1);

        long overdue = active.stream().filter(a -> a.isOverdue(now)).count();
        score -= overdue * 0.15;

        long highPriority = active.stream()
                .filter(a -> a.getPriority() != null && a.getPriority().isHighOrUrgent())
                .count();
        score -= highPriority * 0.1;

        return clamp(score, 0.1, 1);
    }

    double workloadScore(Candidate candidate) {
        int totalMinutes = candidate.activeCommitments().stream()
                .mapToInt(a -> a.getEstimatedMinutes() != null ? a.getEstimatedMinutes() : DEFAULT_TASK_MINUTES)
                .sum();
        double ratio = (double) totalMinutes / IDEAL_WORKLOAD_MINUTES;

        double score;
        if (ratio <= 0.5) {
            // 余裕あり 0.7..1.0
            score = 0.7 + ratio * 0.6;
        } else if (ratio <= 1.0) {
            score = 1.0;
        } else if (ratio <= 1.5) {
            // やや過負荷 1.0..0.8
            score = 1.0 - (ratio - 1.0) * 0.4;
        } else {
            score = Math.max(0.2, 0.8 - (ratio - 1.5) * 0.3);
        }
        return clamp(score, 0.1, 1);
    }

    double performanceScore(Candidate candidate, LocalDateTime now) {
        List<CompletionRecord> history = candidate.historyList();
        if (history.isEmpty()) {
            return 0.6; // 新人は中立
        }

        double score = 0.5;
        double completionRate = completionRate(history);
        score += completionRate * 0.4;

        double avgEfficiency = history.stream()
                .filter(CompletionRecord::isFullyCompleted)
                .mapToDouble(h -> clamp((double) DEFAULT_TASK_MINUTES / Math.max(h.getTimeSpentMinutes(), 1), 0, 1))
                .average()
                .orElse(Double.NaN);
        if (!Double.isNaN(avgEfficiency)) {
            score += avgEfficiency * 0.3;
        }

        LocalDateTime recentFrom = now.minusDays(RECENT_WINDOW_DAYS);
        List<CompletionRecord> recent = history.stream()
                .filter(h -> h.getLastAccessed() != null && h.getLastAccessed().isAfter(recentFrom))
                .toList();
        if (recent.size() >= 3) {
            score += (completionRate(recent) - completionRate) * 0.3;
        }

        return clamp(score, 0.1, 1);
    }

    List<String> keyFactors(Map<String, Double> scores) {
        List<Map.Entry<String, Double>> sorted = new ArrayList<>(scores.entrySet());
        // List.sort は安定ソートなので同点は挿入順
        sorted.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()));

        List<String> factors = new ArrayList<>();
        for (var e : sorted) {
            double v = e.getValue();
            if (v > 0.7) {
                factors.add("Strong " + e.getKey() + " match");
            } else if (v > 0.5) {
                factors.add("Good " + e.getKey() + " alignment");
            } else if (v < 0.3) {
                factors.add("Limited " + e.getKey() + " match");
            }
        }
        return List.copyOf(factors.subList(0, Math.min(3, factors.size())));
    }

    double estimateCompletionMinutes(SopTask task, Candidate candidate) {
        int base = task.getEstimatedMinutes() == null || task.getEstimatedMinutes() == 0
                ? DEFAULT_TASK_MINUTES : task.getEstimatedMinutes();
        double adjusted = base;

        List<StaffSkill> skills = candidate.skillList();
        if (!skills.isEmpty()) {
            double avgLevel = skills.stream().mapToInt(StaffSkill::getProficiencyLevel).average().orElse(0);
            double multiplier = 1 - ((avgLevel - 5) / 10.0) * 0.3;
            adjusted *= Math.max(0.5, multiplier);
        }

        double avgActual = candidate.historyList().stream()
                .filter(CompletionRecord::isFullyCompleted)
                .mapToInt(CompletionRecord::getTimeSpentMinutes)
                .average()
                .orElse(0);
        if (avgActual > 0) {
            adjusted = (adjusted + avgActual) / 2;
        }

        return Math.max(MIN_ESTIMATED_MINUTES, adjusted);
    }

    LocalDateTime recommendedDueDate(LocalDateTime now, double estimatedMinutes, Priority priority) {
        int days = (priority == null ? Priority.MEDIUM : priority).getDueInDays();
        if (estimatedMinutes > 60) days += 1;
        if (estimatedMinutes > 120) days += 1;
        return now.plusDays(days);
    }

    private static double completionRate(List<CompletionRecord> records) {
        long completed = records.stream().filter(CompletionRecord::isFullyCompleted).count();
        return (double) completed / records.size();
    }

    static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }

    public static double round3(double v) {
        return Math.round(v * 1000) / 1000.0;
    }
}
