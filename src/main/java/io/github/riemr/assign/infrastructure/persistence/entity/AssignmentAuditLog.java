package io.github.riemr.assign.infrastructure.persistence.entity;

import lombok.Data;

import java.io.Serializable;
import java.util.Date;

@Data
public class AssignmentAuditLog implements Serializable {
    private Long auditId;
    private String restaurantId;
    private String userId;
    private String action;       // CREATE | UPDATE
    private String resourceType; // smart_assignments | assignment_optimization
    private String resourceId;
    private String details;      // JSON
    private Date createdAt;

    private static final long serialVersionUID = 1L;
}
