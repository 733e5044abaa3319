package io.github.riemr.assign.infrastructure.repository;

import io.github.riemr.assign.application.repository.StaffCandidateRepository;
import io.github.riemr.assign.infrastructure.mapper.StaffCandidateMapper;
import io.github.riemr.assign.infrastructure.persistence.entity.StaffCommitmentRow;
import io.github.riemr.assign.infrastructure.persistence.entity.StaffMember;
import io.github.riemr.assign.infrastructure.persistence.entity.StaffProgressRow;
import io.github.riemr.assign.infrastructure.persistence.entity.StaffSkillProfile;
import io.github.riemr.assign.optimization.model.ActiveCommitment;
import io.github.riemr.assign.optimization.model.AssignmentConstraints;
import io.github.riemr.assign.optimization.model.Candidate;
import io.github.riemr.assign.optimization.model.CommitmentStatus;
import io.github.riemr.assign.optimization.model.CompletionRecord;
import io.github.riemr.assign.optimization.model.Difficulty;
import io.github.riemr.assign.optimization.model.Priority;
import io.github.riemr.assign.optimization.model.StaffRole;
import io.github.riemr.assign.optimization.model.StaffSkill;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Repository
@Slf4j
public class StaffCandidateRepositoryImpl implements StaffCandidateRepository {

    private final StaffCandidateMapper mapper;
    private final ZoneId zoneId;

    public StaffCandidateRepositoryImpl(StaffCandidateMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.zoneId = clock.getZone();
    }

    @Override
    public List<Candidate> findCandidates(String restaurantId, AssignmentConstraints constraints) {
        List<String> roles = constraints.requiredRoles().stream().map(StaffRole::getCode).sorted().toList();
        List<StaffMember> staff = mapper.selectActiveStaff(restaurantId, roles,
                constraints.mustIncludeUsers(), constraints.excludeUsers());
        if (staff.isEmpty()) {
            return List.of();
        }

        List<String> ids = staff.stream().map(StaffMember::getId).toList();
        Map<String, List<StaffSkillProfile>> skillsByUser = mapper.selectSkills(ids).stream()
                .collect(Collectors.groupingBy(StaffSkillProfile::getUserId));
        Map<String, List<StaffCommitmentRow>> commitmentsByUser = mapper.selectActiveCommitments(ids).stream()
                .collect(Collectors.groupingBy(StaffCommitmentRow::getAssignedTo));
        Map<String, List<StaffProgressRow>> historyByUser = mapper.selectProgressHistory(ids).stream()
                .collect(Collectors.groupingBy(StaffProgressRow::getUserId));

        log.debug("Loaded {} staff for restaurant {}", staff.size(), restaurantId);
        return staff.stream()
                .map(s -> Candidate.builder()
                        .id(s.getId())
                        .fullName(s.getFullName())
                        .role(StaffRole.fromCode(s.getRole()))
                        .skills(skillsByUser.getOrDefault(s.getId(), List.of()).stream().map(this::toSkill).toList())
                        .commitments(commitmentsByUser.getOrDefault(s.getId(), List.of()).stream().map(this::toCommitment).toList())
                        .history(historyByUser.getOrDefault(s.getId(), List.of()).stream().map(this::toHistory).toList())
                        .build())
                .toList();
    }

    private StaffSkill toSkill(StaffSkillProfile p) {
        return StaffSkill.builder()
                .skillName(p.getSkillName())
                .skillCategory(p.getSkillCategory())
                .proficiencyLevel(p.getProficiencyLevel() == null ? 0 : p.getProficiencyLevel())
                .build();
    }

    private ActiveCommitment toCommitment(StaffCommitmentRow r) {
        return ActiveCommitment.builder()
                .assignmentId(r.getAssignmentId())
                .sopId(r.getSopId())
                .estimatedMinutes(r.getEstimatedReadTime())
                .dueDate(toLocalDateTime(r.getDueDate()))
                .priority(parsePriority(r.getPriority()))
                .status(CommitmentStatus.fromCode(r.getStatus()))
                .build();
    }

    private CompletionRecord toHistory(StaffProgressRow r) {
        return CompletionRecord.builder()
                .difficulty(Difficulty.fromCode(r.getDifficultyLevel()))
                .progressPercentage(r.getProgressPercentage() == null ? 0 : r.getProgressPercentage())
                .timeSpentMinutes(r.getTimeSpent() == null ? 0 : r.getTimeSpent())
                .lastAccessed(toLocalDateTime(r.getLastAccessed()))
                .build();
    }

    private Priority parsePriority(String code) {
        try {
            return Priority.fromCode(code);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown assignment priority '{}', treated as unset", code);
            return null;
        }
    }

    private LocalDateTime toLocalDateTime(Date date) {
        return date == null ? null : date.toInstant().atZone(zoneId).toLocalDateTime();
    }
}
