package io.github.riemr.assign.application.service;

import io.github.riemr.assign.application.dto.ConstraintsRequest;
import io.github.riemr.assign.application.dto.CriteriaRequest;
import io.github.riemr.assign.optimization.config.OptimizerDefaults;
import io.github.riemr.assign.optimization.model.CriteriaWeights;
import io.github.riemr.assign.optimization.model.Priority;
import io.github.riemr.assign.optimization.model.RunConfiguration;
import io.github.riemr.assign.optimization.model.StaffRole;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunConfigurationFactoryTest {

    RunConfigurationFactory factory = new RunConfigurationFactory(
            new OptimizerDefaults(CriteriaWeights.DEFAULT, 3, Priority.MEDIUM));

    @Test
    void missingSections_fallBackToDefaults() {
        RunConfiguration run = factory.create(null, null, null);

        assertThat(run.weights()).isEqualTo(CriteriaWeights.DEFAULT);
        assertThat(run.priority()).isEqualTo(Priority.MEDIUM);
        assertThat(run.constraints().maxAssignmentsPerPerson()).isEqualTo(3);
        assertThat(run.constraints().requiredRoles()).isEmpty();
    }

    @Test
    void suppliedZeroWeight_isKept() {
        CriteriaRequest criteria = new CriteriaRequest();
        criteria.setFairnessWeight(0.0);
        criteria.setSkillWeight(0.2);

        RunConfiguration run = factory.create(criteria, "HIGH", null);

        assertThat(run.weights()).isEqualTo(new CriteriaWeights(0.2, 0.25, 0.2, 0.25, 0.0));
        assertThat(run.priority()).isEqualTo(Priority.HIGH);
    }

    @Test
    void partialWeights_exceedingOneWithDefaults_areRejected() {
        // 0.9 + 0.25 + 0.2 + 0.25
        CriteriaRequest criteria = new CriteriaRequest();
        criteria.setSkillWeight(0.9);

        assertThatThrownBy(() -> factory.create(criteria, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("skill, availability, workload and performance weights must not sum to more than 1");
    }

    @Test
    void constraints_areParsed_andBlankIdsDropped() {
        ConstraintsRequest c = new ConstraintsRequest();
        c.setMaxAssignmentsPerPerson(2);
        c.setRequiredRoles(List.of("chef", "Manager"));
        c.setExcludeUsers(Arrays.asList("u1", "", null));
        c.setMustIncludeUsers(List.of("u2"));

        RunConfiguration run = factory.create(null, "low", c);

        assertThat(run.constraints().maxAssignmentsPerPerson()).isEqualTo(2);
        assertThat(run.constraints().requiredRoles()).containsExactlyInAnyOrder(StaffRole.CHEF, StaffRole.MANAGER);
        assertThat(run.constraints().excludeUsers()).containsExactly("u1");
        assertThat(run.constraints().mustIncludeUsers()).containsExactly("u2");
        assertThat(run.priority()).isEqualTo(Priority.LOW);
    }

    @Test
    void unknownRoleOrPriority_isRejected() {
        ConstraintsRequest c = new ConstraintsRequest();
        c.setRequiredRoles(List.of("dishwasher"));

        assertThatThrownBy(() -> factory.create(null, null, c))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("unknown role: dishwasher");
        assertThatThrownBy(() -> factory.create(null, "asap", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("unknown priority: asap");
    }
}
