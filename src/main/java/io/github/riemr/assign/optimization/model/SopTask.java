package io.github.riemr.assign.optimization.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 割当対象の SOP。1 回の最適化の間は不変。
 */
@Value
@Builder
public class SopTask {
    String id;
    String title;
    Difficulty difficulty;
    /** 標準所要時間（分）。null / 0 は既定 30 分 */
    Integer estimatedMinutes;
    List<String> tags;
    String categoryName;

    public List<String> normalizedTags() {
        return Optional.ofNullable(tags).orElse(List.of()).stream()
                .filter(t -> t != null)
                .map(t -> t.toLowerCase(Locale.ROOT))
                .toList();
    }

    public String normalizedCategory() {
        return categoryName == null ? "" : categoryName.toLowerCase(Locale.ROOT);
    }
}
