package io.github.riemr.assign.application.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.util.List;

import static io.github.riemr.assign.application.dto.Identifiers.UUID_PATTERN;

@Data
public class SmartAssignRequest {
    @NotBlank
    private String restaurantId;
    @NotEmpty(message = "At least one SOP ID is required")
    private List<String> sopIds;
    private String priority; // low | medium | high | urgent
    @Valid
    private CriteriaRequest criteria;
    @Valid
    private ConstraintsRequest constraints;
    /** 割当実行者（sop_assignments.assigned_by, UUID） */
    @Pattern(regexp = UUID_PATTERN, message = "requestedBy must be a UUID")
    private String requestedBy;
}
