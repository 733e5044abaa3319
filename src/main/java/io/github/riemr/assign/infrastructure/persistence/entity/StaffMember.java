package io.github.riemr.assign.infrastructure.persistence.entity;

import lombok.Data;

import java.io.Serializable;

@Data
public class StaffMember implements Serializable {
    private String id;
    private String restaurantId;
    private String fullName;
    private String email;
    private String role;
    private Boolean active;

    private static final long serialVersionUID = 1L;
}
