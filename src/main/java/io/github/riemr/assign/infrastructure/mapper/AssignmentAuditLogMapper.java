package io.github.riemr.assign.infrastructure.mapper;

import io.github.riemr.assign.infrastructure.persistence.entity.AssignmentAuditLog;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;

@Mapper
public interface AssignmentAuditLogMapper {

    @Insert("INSERT INTO assignment_audit_logs (restaurant_id, user_id, action, resource_type, resource_id, details, created_at) " +
            "VALUES (#{restaurantId}, #{userId}, #{action}, #{resourceType}, #{resourceId}, CAST(#{details} AS JSONB), #{createdAt})")
    @Options(useGeneratedKeys = true, keyProperty = "auditId", keyColumn = "audit_id")
    int insert(AssignmentAuditLog row);
}
