package io.github.riemr.assign.application.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class SopAssignmentView {
    String id;
    String sopId;
    String assignedTo;
    String assignedBy;
    LocalDateTime dueDate;
    String priority;
    String status;
    String notes;
}
