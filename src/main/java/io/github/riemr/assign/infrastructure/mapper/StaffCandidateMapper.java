package io.github.riemr.assign.infrastructure.mapper;

import io.github.riemr.assign.infrastructure.persistence.entity.StaffCommitmentRow;
import io.github.riemr.assign.infrastructure.persistence.entity.StaffMember;
import io.github.riemr.assign.infrastructure.persistence.entity.StaffProgressRow;
import io.github.riemr.assign.infrastructure.persistence.entity.StaffSkillProfile;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.Collection;
import java.util.List;

@Mapper
public interface StaffCandidateMapper {

    @Select("<script>" +
            "SELECT CAST(id AS VARCHAR) AS id, CAST(restaurant_id AS VARCHAR) AS restaurantId, " +
            "full_name AS fullName, email, role, is_active AS active " +
            "FROM auth_users " +
            "WHERE CAST(restaurant_id AS VARCHAR) = #{restaurantId} AND is_active = TRUE " +
            "<if test='roles != null and !roles.isEmpty()'>" +
            "  AND (role IN <foreach collection='roles' item='r' open='(' separator=',' close=')'>#{r}</foreach>" +
            "  <if test='mustInclude != null and !mustInclude.isEmpty()'>" +
            "    OR CAST(id AS VARCHAR) IN <foreach collection='mustInclude' item='m' open='(' separator=',' close=')'>#{m}</foreach>" +
            "  </if>)" +
            "</if>" +
            "<if test='excludeIds != null and !excludeIds.isEmpty()'>" +
            "  AND CAST(id AS VARCHAR) NOT IN <foreach collection='excludeIds' item='x' open='(' separator=',' close=')'>#{x}</foreach>" +
            "</if>" +
            " ORDER BY full_name, id" +
            "</script>")
    List<StaffMember> selectActiveStaff(@Param("restaurantId") String restaurantId,
                                        @Param("roles") Collection<String> roles,
                                        @Param("mustInclude") Collection<String> mustInclude,
                                        @Param("excludeIds") Collection<String> excludeIds);

    @Select("<script>" +
            "SELECT CAST(user_id AS VARCHAR) AS userId, skill_name AS skillName, " +
            "skill_category AS skillCategory, proficiency_level AS proficiencyLevel " +
            "FROM staff_skill_profiles " +
            "WHERE CAST(user_id AS VARCHAR) IN <foreach collection='userIds' item='u' open='(' separator=',' close=')'>#{u}</foreach>" +
            " ORDER BY user_id, skill_name" +
            "</script>")
    List<StaffSkillProfile> selectSkills(@Param("userIds") Collection<String> userIds);

    @Select("<script>" +
            "SELECT CAST(a.id AS VARCHAR) AS assignmentId, CAST(a.assigned_to AS VARCHAR) AS assignedTo, " +
            "CAST(a.sop_id AS VARCHAR) AS sopId, a.due_date AS dueDate, a.status, a.priority, " +
            "d.estimated_read_time AS estimatedReadTime " +
            "FROM sop_assignments a JOIN sop_documents d ON d.id = a.sop_id " +
            "WHERE a.status IN ('pending', 'in_progress') " +
            "AND CAST(a.assigned_to AS VARCHAR) IN <foreach collection='userIds' item='u' open='(' separator=',' close=')'>#{u}</foreach>" +
            " ORDER BY a.assigned_to, a.due_date, a.id" +
            "</script>")
    List<StaffCommitmentRow> selectActiveCommitments(@Param("userIds") Collection<String> userIds);

    @Select("<script>" +
            "SELECT CAST(p.user_id AS VARCHAR) AS userId, p.progress_percentage AS progressPercentage, " +
            "p.time_spent AS timeSpent, p.last_accessed AS lastAccessed, d.difficulty_level AS difficultyLevel " +
            "FROM user_progress p JOIN sop_documents d ON d.id = p.sop_id " +
            "WHERE CAST(p.user_id AS VARCHAR) IN <foreach collection='userIds' item='u' open='(' separator=',' close=')'>#{u}</foreach>" +
            " ORDER BY p.user_id, p.last_accessed" +
            "</script>")
    List<StaffProgressRow> selectProgressHistory(@Param("userIds") Collection<String> userIds);
}
