package io.github.riemr.assign.optimization.config;

import io.github.riemr.assign.optimization.model.CriteriaWeights;
import io.github.riemr.assign.optimization.model.Priority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@Slf4j
public class OptimizerConfig {

    // 評価基準の既定重み
    @Value("${assign.criteria.skill-weight:0.3}")
    private double skillWeight;
    @Value("${assign.criteria.availability-weight:0.25}")
    private double availabilityWeight;
    @Value("${assign.criteria.workload-weight:0.2}")
    private double workloadWeight;
    @Value("${assign.criteria.performance-weight:0.25}")
    private double performanceWeight;
    @Value("${assign.criteria.fairness-weight:0.2}")
    private double fairnessWeight;

    @Value("${assign.constraints.max-assignments-per-person:3}")
    private int maxAssignmentsPerPerson;

    @Value("${assign.default-priority:medium}")
    private String defaultPriority;

    // 期限計算・直近 30 日判定の基準タイムゾーン
    @Value("${assign.zone:UTC}")
    private String zone;

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.system(ZoneId.of(zone));
    }

    @Bean
    public OptimizerDefaults optimizerDefaults() {
        CriteriaWeights weights = new CriteriaWeights(
                skillWeight, availabilityWeight, workloadWeight, performanceWeight, fairnessWeight);
        Priority priority = Priority.fromCode(defaultPriority);
        OptimizerDefaults defaults = new OptimizerDefaults(weights, maxAssignmentsPerPerson,
                priority == null ? Priority.MEDIUM : priority);
        log.info("Optimizer defaults: {}", defaults);
        return defaults;
    }
}
