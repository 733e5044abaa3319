package io.github.riemr.assign.application.dto;

import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.List;

@Data
public class ConstraintsRequest {
    @Min(1)
    private Integer maxAssignmentsPerPerson;
    private List<String> requiredRoles;
    private List<String> excludeUsers;
    private List<String> mustIncludeUsers;
}
