package io.github.riemr.assign.application.repository;

import io.github.riemr.assign.optimization.model.SopTask;

import java.util.List;

public interface SopTaskRepository {
    /** 指定順で返す。存在しない・無効な SOP は含まない */
    List<SopTask> findActiveByIds(String restaurantId, List<String> sopIds);
}
