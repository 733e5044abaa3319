package io.github.riemr.assign.infrastructure.repository;

import io.github.riemr.assign.application.repository.SopTaskRepository;
import io.github.riemr.assign.infrastructure.mapper.SopDocumentMapper;
import io.github.riemr.assign.infrastructure.persistence.entity.SopDocument;
import io.github.riemr.assign.optimization.model.Difficulty;
import io.github.riemr.assign.optimization.model.SopTask;
import org.springframework.stereotype.Repository;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

@Repository
public class SopTaskRepositoryImpl implements SopTaskRepository {

    private final SopDocumentMapper mapper;

    public SopTaskRepositoryImpl(SopDocumentMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public List<SopTask> findActiveByIds(String restaurantId, List<String> sopIds) {
        if (sopIds == null || sopIds.isEmpty()) {
            return List.of();
        }
        Map<String, SopDocument> byId = mapper.selectActiveByIds(restaurantId, sopIds).stream()
                .collect(Collectors.toMap(SopDocument::getId, Function.identity(), (a, b) -> a));
        // リクエストの順序を保つ（重複は除く）
        return sopIds.stream()
                .distinct()
                .map(byId::get)
                .filter(Objects::nonNull)
                .map(this::toTask)
                .toList();
    }

    private SopTask toTask(SopDocument d) {
        List<String> tags = d.getTagsCsv() == null || d.getTagsCsv().isBlank()
                ? List.of()
                : Arrays.stream(d.getTagsCsv().split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
        return SopTask.builder()
                .id(d.getId())
                .title(d.getTitle())
                .difficulty(Difficulty.fromCode(d.getDifficultyLevel()))
                .estimatedMinutes(d.getEstimatedReadTime())
                .tags(tags)
                .categoryName(d.getCategoryName())
                .build();
    }
}
