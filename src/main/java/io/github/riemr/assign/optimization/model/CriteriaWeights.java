package io.github.riemr.assign.optimization.model;

/**
 * 評価基準ごとの重み（0..1）。
 * 総合スコアを 0..1 に収めるため、skill + availability + workload + performance は 1 以下。
 * fairness は割当時の補正にのみ使うので合計に含めない。
 */
public record CriteriaWeights(
        double skill,
        double availability,
        double workload,
        double performance,
        double fairness
) {
    /** 浮動小数の誤差分 */
    public static final double SUM_TOLERANCE = 1e-9;

    public CriteriaWeights {
        requireUnit("skill", skill);
        requireUnit("availability", availability);
        requireUnit("workload", workload);
        requireUnit("performance", performance);
        requireUnit("fairness", fairness);
        if (scoringSum(skill, availability, workload, performance) > 1 + SUM_TOLERANCE) {
            throw new IllegalArgumentException(
                    "skill, availability, workload and performance weights must not sum to more than 1");
        }
    }

    public static final CriteriaWeights DEFAULT = new CriteriaWeights(0.3, 0.25, 0.2, 0.25, 0.2);

    /** null の項目は defaults の値で補完する */
    public static CriteriaWeights of(Double skill, Double availability, Double workload,
                                     Double performance, Double fairness, CriteriaWeights defaults) {
        return new CriteriaWeights(
                skill != null ? skill : defaults.skill(),
                availability != null ? availability : defaults.availability(),
                workload != null ? workload : defaults.workload(),
                performance != null ? performance : defaults.performance(),
                fairness != null ? fairness : defaults.fairness());
    }

    public static double scoringSum(double skill, double availability, double workload, double performance) {
        return skill + availability + workload + performance;
    }

    private static void requireUnit(String name, double weight) {
        if (!(weight >= 0 && weight <= 1)) {
            throw new IllegalArgumentException(name + " weight must be between 0 and 1");
        }
    }
}
