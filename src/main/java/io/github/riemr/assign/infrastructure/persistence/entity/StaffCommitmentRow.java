package io.github.riemr.assign.infrastructure.persistence.entity;

import lombok.Data;

import java.io.Serializable;
import java.util.Date;

/**
 * sop_assignments と sop_documents.estimated_read_time の結合行。
 */
@Data
public class StaffCommitmentRow implements Serializable {
    private String assignmentId;
    private String assignedTo;
    private String sopId;
    private Date dueDate;
    private String status;
    private String priority;
    private Integer estimatedReadTime;

    private static final long serialVersionUID = 1L;
}
