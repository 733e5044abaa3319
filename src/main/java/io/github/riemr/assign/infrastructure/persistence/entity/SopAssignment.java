package io.github.riemr.assign.infrastructure.persistence.entity;

import java.io.Serializable;
import java.util.Date;

/**
 * sop_assignments の 1 行。最適化結果を採用した時点で作成される。
 */
public class SopAssignment implements Serializable {
    private String id;
    private String restaurantId;
    private String sopId;
    private String assignedTo;
    private String assignedBy;
    private Date dueDate;
    private String priority; // low | medium | high | urgent
    private String status;   // pending | in_progress | completed | cancelled
    private String notes;
    private Date createdAt;
    private Date updatedAt;

    private static final long serialVersionUID = 1L;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getRestaurantId() { return restaurantId; }
    public void setRestaurantId(String restaurantId) { this.restaurantId = restaurantId; }
    public String getSopId() { return sopId; }
    public void setSopId(String sopId) { this.sopId = sopId; }
    public String getAssignedTo() { return assignedTo; }
    public void setAssignedTo(String assignedTo) { this.assignedTo = assignedTo; }
    public String getAssignedBy() { return assignedBy; }
    public void setAssignedBy(String assignedBy) { this.assignedBy = assignedBy; }
    public Date getDueDate() { return dueDate; }
    public void setDueDate(Date dueDate) { this.dueDate = dueDate; }
    public String getPriority() { return priority; }
    public void setPriority(String priority) { this.priority = priority; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
    public Date getCreatedAt() { return createdAt; }
    public void setCreatedAt(Date createdAt) { this.createdAt = createdAt; }
    public Date getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Date updatedAt) { this.updatedAt = updatedAt; }
}
