package io.github.riemr.assign.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.riemr.assign.application.dto.AppliedAssignmentsResponse;
import io.github.riemr.assign.application.dto.ReoptimizeRequest;
import io.github.riemr.assign.application.dto.SmartAssignRequest;
import io.github.riemr.assign.application.dto.SopAssignmentView;
import io.github.riemr.assign.application.repository.AssignmentAuditRepository;
import io.github.riemr.assign.application.repository.SopAssignmentRepository;
import io.github.riemr.assign.application.repository.SopTaskRepository;
import io.github.riemr.assign.application.repository.StaffCandidateRepository;
import io.github.riemr.assign.infrastructure.persistence.entity.AssignmentAuditLog;
import io.github.riemr.assign.infrastructure.persistence.entity.SopAssignment;
import io.github.riemr.assign.optimization.model.Candidate;
import io.github.riemr.assign.optimization.model.CommitmentStatus;
import io.github.riemr.assign.optimization.model.Priority;
import io.github.riemr.assign.optimization.model.RunConfiguration;
import io.github.riemr.assign.optimization.model.SopTask;
import io.github.riemr.assign.optimization.service.AssignmentOptimizer;
import io.github.riemr.assign.optimization.solution.AssignmentDecision;
import io.github.riemr.assign.optimization.solution.OptimizationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * SOP のスマート割当。最適化結果の提示、採用した結果の登録、既存割当の再最適化を行う。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SmartAssignmentService {

    static final String SYSTEM_USER = "system";

    private final SopTaskRepository taskRepository;
    private final StaffCandidateRepository candidateRepository;
    private final SopAssignmentRepository assignmentRepository;
    private final AssignmentAuditRepository auditRepository;
    private final AssignmentOptimizer optimizer;
    private final RunConfigurationFactory runConfigurationFactory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /** 登録は行わず、最適な割当案だけを返す */
    public OptimizationResult recommend(SmartAssignRequest req) {
        RunConfiguration run = runConfigurationFactory.create(req.getCriteria(), req.getPriority(), req.getConstraints());
        return optimize(req.getRestaurantId(), req.getSopIds(), run);
    }

    @Transactional
    public AppliedAssignmentsResponse createAssignments(SmartAssignRequest req) {
        RunConfiguration run = runConfigurationFactory.create(req.getCriteria(), req.getPriority(), req.getConstraints());
        OptimizationResult result = optimize(req.getRestaurantId(), req.getSopIds(), run);

        List<SopAssignment> created = applyAccepted(req.getRestaurantId(), result.assignments(),
                req.getRequestedBy(), run.priority());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sopIds", req.getSopIds());
        details.put("priority", run.priority().getCode());
        details.put("assignmentsCreated", created.size());
        details.put("optimizationScore", result.metrics().totalScore());
        audit(req.getRestaurantId(), req.getRequestedBy(), "CREATE", "smart_assignments", details);

        log.info("Created {} optimized assignments for restaurant {}", created.size(), req.getRestaurantId());
        return toResponse(created, result);
    }

    /**
     * 採用された割当結果を sop_assignments に登録する。
     */
    @Transactional
    public List<SopAssignment> applyAccepted(String restaurantId, List<AssignmentDecision> decisions,
                                             String assignedBy, Priority priority) {
        Date now = Date.from(clock.instant());
        List<SopAssignment> created = new ArrayList<>();
        for (AssignmentDecision d : decisions) {
            SopAssignment row = new SopAssignment();
            row.setRestaurantId(restaurantId);
            row.setSopId(d.getSopId());
            row.setAssignedTo(d.getAssignedTo());
            row.setAssignedBy(assignedBy);
            row.setDueDate(toDate(d.getRecommendedDueDate()));
            row.setPriority((priority == null ? Priority.MEDIUM : priority).getCode());
            row.setStatus(CommitmentStatus.PENDING.getCode());
            row.setNotes("Optimized assignment (score: " + d.getAssignmentScore() + ")");
            row.setCreatedAt(now);
            row.setUpdatedAt(now);
            assignmentRepository.save(row);
            created.add(row);
        }
        return created;
    }

    /**
     * 既存の未完了割当の SOP を再最適化し、担当者・期限を更新する。
     */
    @Transactional
    public AppliedAssignmentsResponse reoptimize(ReoptimizeRequest req) {
        List<SopAssignment> existing = assignmentRepository.findOptimizable(req.getRestaurantId(), req.getAssignmentIds());
        if (existing.isEmpty()) {
            throw new NoSuchElementException("No optimizable assignments found");
        }

        // 同じ SOP の割当が複数ある場合は先頭のみ更新対象
        Map<String, SopAssignment> bySop = existing.stream()
                .collect(Collectors.toMap(SopAssignment::getSopId, a -> a, (a, b) -> a, LinkedHashMap::new));

        RunConfiguration run = runConfigurationFactory.create(req.getCriteria(), null, null);
        OptimizationResult result = optimize(req.getRestaurantId(), new ArrayList<>(bySop.keySet()), run);

        Date now = Date.from(clock.instant());
        List<SopAssignment> updated = new ArrayList<>();
        for (AssignmentDecision d : result.assignments()) {
            SopAssignment row = bySop.get(d.getSopId());
            if (row == null) continue;
            row.setAssignedTo(d.getAssignedTo());
            row.setDueDate(toDate(d.getRecommendedDueDate()));
            row.setNotes("Re-optimized assignment (score: " + d.getAssignmentScore() + ")");
            row.setUpdatedAt(now);
            assignmentRepository.updateAssignee(row);
            updated.add(row);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("assignmentsOptimized", updated.size());
        details.put("optimizationScore", result.metrics().totalScore());
        audit(req.getRestaurantId(), req.getRequestedBy(), "UPDATE", "assignment_optimization", details);

        log.info("Re-optimized {} of {} assignments for restaurant {}", updated.size(), existing.size(), req.getRestaurantId());
        return toResponse(updated, result);
    }

    private OptimizationResult optimize(String restaurantId, List<String> sopIds, RunConfiguration run) {
        List<Candidate> staff = candidateRepository.findCandidates(restaurantId, run.constraints());
        List<SopTask> sops = taskRepository.findActiveByIds(restaurantId, sopIds);
        return optimizer.optimize(sops, staff, run);
    }

    private void audit(String restaurantId, String userId, String action, String resourceType, Map<String, Object> details) {
        AssignmentAuditLog entry = new AssignmentAuditLog();
        entry.setRestaurantId(restaurantId);
        entry.setUserId(userId == null ? SYSTEM_USER : userId);
        entry.setAction(action);
        entry.setResourceType(resourceType);
        entry.setResourceId("batch_" + clock.millis());
        entry.setDetails(toJson(details));
        entry.setCreatedAt(Date.from(clock.instant()));
        auditRepository.record(entry);
    }

    private String toJson(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit details", e);
        }
    }

    private AppliedAssignmentsResponse toResponse(List<SopAssignment> rows, OptimizationResult result) {
        return AppliedAssignmentsResponse.builder()
                .assignments(rows.stream().map(this::toView).toList())
                .optimizationSummary(result.metrics())
                .recommendations(result.recommendations())
                .warnings(result.warnings())
                .build();
    }

    private SopAssignmentView toView(SopAssignment a) {
        return SopAssignmentView.builder()
                .id(a.getId())
                .sopId(a.getSopId())
                .assignedTo(a.getAssignedTo())
                .assignedBy(a.getAssignedBy())
                .dueDate(toLocalDateTime(a.getDueDate()))
                .priority(a.getPriority())
                .status(a.getStatus())
                .notes(a.getNotes())
                .build();
    }

    private Date toDate(LocalDateTime ldt) {
        return ldt == null ? null : Date.from(ldt.atZone(clock.getZone()).toInstant());
    }

    private LocalDateTime toLocalDateTime(Date date) {
        return date == null ? null : date.toInstant().atZone(clock.getZone()).toLocalDateTime();
    }
}
