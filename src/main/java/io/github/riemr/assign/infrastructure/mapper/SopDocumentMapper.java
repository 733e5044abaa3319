package io.github.riemr.assign.infrastructure.mapper;

import io.github.riemr.assign.infrastructure.persistence.entity.SopDocument;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.Collection;
import java.util.List;

@Mapper
public interface SopDocumentMapper {

    @Select("<script>" +
            "SELECT CAST(d.id AS VARCHAR) AS id, CAST(d.restaurant_id AS VARCHAR) AS restaurantId, d.title, " +
            "d.difficulty_level AS difficultyLevel, d.estimated_read_time AS estimatedReadTime, " +
            "array_to_string(d.tags, ',') AS tagsCsv, c.name AS categoryName " +
            "FROM sop_documents d JOIN sop_categories c ON c.id = d.category_id " +
            "WHERE CAST(d.restaurant_id AS VARCHAR) = #{restaurantId} AND d.is_active = TRUE " +
            "AND CAST(d.id AS VARCHAR) IN <foreach collection='sopIds' item='s' open='(' separator=',' close=')'>#{s}</foreach>" +
            "</script>")
    List<SopDocument> selectActiveByIds(@Param("restaurantId") String restaurantId,
                                        @Param("sopIds") Collection<String> sopIds);
}
