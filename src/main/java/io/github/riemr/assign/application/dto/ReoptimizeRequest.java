package io.github.riemr.assign.application.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.util.List;

import static io.github.riemr.assign.application.dto.Identifiers.UUID_PATTERN;

@Data
public class ReoptimizeRequest {
    @NotBlank
    private String restaurantId;
    @NotEmpty(message = "At least one assignment ID is required")
    private List<String> assignmentIds;
    @Valid
    private CriteriaRequest criteria;
    /** 割当実行者（sop_assignments.assigned_by, UUID） */
    @Pattern(regexp = UUID_PATTERN, message = "requestedBy must be a UUID")
    private String requestedBy;
}
