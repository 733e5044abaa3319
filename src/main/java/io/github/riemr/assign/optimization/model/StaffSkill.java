package io.github.riemr.assign.optimization.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StaffSkill {
    String skillName;
    String skillCategory;
    /** 1..10 */
    int proficiencyLevel;
}
