package io.github.riemr.assign.infrastructure.persistence.entity;

import lombok.Data;

import java.io.Serializable;

@Data
public class StaffSkillProfile implements Serializable {
    private String userId;
    private String skillName;
    private String skillCategory;
    private Integer proficiencyLevel; // 1..10

    private static final long serialVersionUID = 1L;
}
