package io.github.riemr.assign.infrastructure.persistence.entity;

import lombok.Data;

import java.io.Serializable;

@Data
public class SopDocument implements Serializable {
    private String id;
    private String restaurantId;
    private String title;
    private String difficultyLevel;
    private Integer estimatedReadTime;
    /** tags 配列をカンマ区切りにしたもの */
    private String tagsCsv;
    private String categoryName;

    private static final long serialVersionUID = 1L;
}
