package io.github.riemr.assign.infrastructure.persistence.entity;

import lombok.Data;

import java.io.Serializable;
import java.util.Date;

/**
 * user_progress と sop_documents.difficulty_level の結合行。
 */
@Data
public class StaffProgressRow implements Serializable {
    private String userId;
    private Integer progressPercentage;
    private Integer timeSpent; // minutes
    private Date lastAccessed;
    private String difficultyLevel;

    private static final long serialVersionUID = 1L;
}
