package io.github.riemr.assign.infrastructure.mapper;

import io.github.riemr.assign.infrastructure.persistence.entity.SopAssignment;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.Collection;
import java.util.List;

@Mapper
public interface SopAssignmentMapper {

    @Insert("INSERT INTO sop_assignments (restaurant_id, sop_id, assigned_to, assigned_by, due_date, priority, status, notes, created_at, updated_at) " +
            "VALUES (CAST(#{restaurantId} AS UUID), CAST(#{sopId} AS UUID), CAST(#{assignedTo} AS UUID), CAST(#{assignedBy} AS UUID), " +
            "#{dueDate}, #{priority}, #{status}, #{notes}, #{createdAt}, #{updatedAt})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insert(SopAssignment row);

    @Update("UPDATE sop_assignments SET assigned_to = CAST(#{assignedTo} AS UUID), due_date = #{dueDate}, " +
            "notes = #{notes}, updated_at = #{updatedAt} " +
            "WHERE CAST(id AS VARCHAR) = #{id}")
    int updateAssignee(SopAssignment row);

    @Select("<script>" +
            "SELECT CAST(id AS VARCHAR) AS id, CAST(restaurant_id AS VARCHAR) AS restaurantId, " +
            "CAST(sop_id AS VARCHAR) AS sopId, CAST(assigned_to AS VARCHAR) AS assignedTo, " +
            "CAST(assigned_by AS VARCHAR) AS assignedBy, due_date AS dueDate, priority, status, notes, " +
            "created_at AS createdAt, updated_at AS updatedAt " +
            "FROM sop_assignments " +
            "WHERE CAST(restaurant_id AS VARCHAR) = #{restaurantId} AND status IN ('pending', 'in_progress') " +
            "AND CAST(id AS VARCHAR) IN <foreach collection='ids' item='i' open='(' separator=',' close=')'>#{i}</foreach>" +
            " ORDER BY created_at, id" +
            "</script>")
    List<SopAssignment> selectOptimizable(@Param("restaurantId") String restaurantId,
                                          @Param("ids") Collection<String> ids);
}
