package org.talentia.engine.api;

import org.talentia.engine.api.dto.AssignmentBatchResponseDto;
import org.talentia.engine.api.dto.AssignmentDto;
import org.talentia.engine.api.dto.AssignmentListResponseDto;
import org.talentia.engine.api.dto.AssignmentStatsDto;
import org.talentia.engine.api.dto.ErrorResponseDto;
import org.talentia.engine.api.dto.PageMetaDto;
import org.talentia.engine.api.dto.PositionSuggestionsDto;
import org.talentia.engine.api.dto.RedistributionMoveDto;
import org.talentia.engine.api.dto.RedistributionResponseDto;
import org.talentia.engine.api.dto.SuggestedRecruiterDto;
import org.talentia.engine.api.dto.SuggestionsResponseDto;
import org.talentia.engine.domain.model.Assignment;
import org.talentia.engine.domain.model.AssignmentBatchResult;
import org.talentia.engine.domain.model.AssignmentStats;
import org.talentia.engine.domain.model.AssignmentView;
import org.talentia.engine.domain.model.PageResult;
import org.talentia.engine.domain.model.Position;
import org.talentia.engine.domain.model.PositionSuggestions;
import org.talentia.engine.domain.model.PriorityResult;
import org.talentia.engine.domain.model.QueueType;
import org.talentia.engine.domain.model.Recruiter;
import org.talentia.engine.domain.model.RedistributionMove;
import org.talentia.engine.domain.model.RedistributionPlan;
import org.talentia.engine.domain.model.ScoredRecruiter;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Converts domain results into wire DTOs.
 */
public final class DtoMapper {

    private DtoMapper() {
    }

    public static AssignmentBatchResponseDto toBatchResponse(AssignmentBatchResult result) {
        AssignmentBatchResponseDto dto = new AssignmentBatchResponseDto();
        dto.setSuccess(true);
        dto.setBatchId(result.getBatchId());
        dto.setState(result.getState().name());
        dto.setData(toAssignments(result.getAssignments()));
        dto.setStats(toStats(result.getStats()));
        dto.setMessage(result.getMessage());
        dto.setWarning(result.getWarning().orElse(null));
        return dto;
    }

    public static AssignmentListResponseDto toListResponse(PageResult<AssignmentView> page) {
        PageMetaDto meta = new PageMetaDto();
        meta.setTotal(page.getTotal());
        meta.setPage(page.getPage());
        meta.setPerPage(page.getPerPage());

        AssignmentListResponseDto dto = new AssignmentListResponseDto();
        dto.setSuccess(true);
        dto.setData(toAssignments(page.getItems()));
        dto.setMeta(meta);
        return dto;
    }

    public static SuggestionsResponseDto toSuggestionsResponse(List<PositionSuggestions> suggestions) {
        Map<QueueType, Integer> counts = new EnumMap<>(QueueType.class);
        for (QueueType queue : QueueType.values()) {
            counts.put(queue, 0);
        }
        for (PositionSuggestions entry : suggestions) {
            counts.merge(entry.getPriority().getQueue(), 1, Integer::sum);
        }
        Map<String, Integer> queues = new LinkedHashMap<>();
        counts.forEach((queue, count) -> queues.put(queue.getValue(), count));

        SuggestionsResponseDto dto = new SuggestionsResponseDto();
        dto.setSuccess(true);
        dto.setData(suggestions.stream().map(DtoMapper::toPositionSuggestions).collect(Collectors.toList()));
        dto.setQueues(queues);
        return dto;
    }

    public static PositionSuggestionsDto toPositionSuggestions(PositionSuggestions suggestions) {
        Position position = suggestions.getPosition();
        PriorityResult priority = suggestions.getPriority();

        PositionSuggestionsDto dto = new PositionSuggestionsDto();
        dto.setPositionId(position.getId());
        dto.setTitle(position.getTitle());
        dto.setZone(position.getZone().name());
        dto.setPriority(position.getPriority().name());
        dto.setStatus(position.getStatus().getValue());
        dto.setRecruiterId(position.getRecruiterId());
        dto.setPriorityScore(priority.getScore());
        dto.setQueue(priority.getQueue().getValue());
        dto.setOverdueDays(priority.getOverdueDays());
        dto.setPriorityExplanation(priority.getExplanation());
        dto.setSuggestions(suggestions.getSuggestions().stream()
                .map(DtoMapper::toSuggestedRecruiter)
                .collect(Collectors.toList()));
        return dto;
    }

    public static RedistributionResponseDto toRedistributionResponse(RedistributionPlan plan) {
        RedistributionResponseDto dto = new RedistributionResponseDto();
        dto.setSuccess(true);
        dto.setBalanced(plan.isBalanced());
        dto.setMoves(plan.getMoves().stream().map(DtoMapper::toMove).collect(Collectors.toList()));
        dto.setTotalCasesToMove(plan.getTotalCasesToMove());
        dto.setOverloadedCount(plan.getOverloadedCount());
        dto.setAvailableCount(plan.getAvailableCount());
        dto.setMessage(plan.getSummary());
        return dto;
    }

    public static ErrorResponseDto toError(String message, Map<String, Object> details) {
        ErrorResponseDto dto = new ErrorResponseDto();
        dto.setSuccess(false);
        dto.setError(message);
        dto.setDetails(details == null || details.isEmpty() ? null : details);
        return dto;
    }

    private static SuggestedRecruiterDto toSuggestedRecruiter(ScoredRecruiter scored) {
        Recruiter recruiter = scored.getRecruiter();
        SuggestedRecruiterDto dto = new SuggestedRecruiterDto();
        dto.setRecruiterId(recruiter.getId());
        dto.setName(recruiter.getName());
        dto.setScore(scored.getScore());
        dto.setScoreBreakdown(scored.getFitScore().getBreakdown().toMap());
        dto.setExplanation(scored.getFitScore().getExplanation());
        dto.setCurrentLoad(recruiter.getCurrentLoad());
        dto.setCapacity(recruiter.getCapacity());
        return dto;
    }

    private static RedistributionMoveDto toMove(RedistributionMove move) {
        RedistributionMoveDto dto = new RedistributionMoveDto();
        dto.setFromRecruiterId(move.getFrom().getId());
        dto.setFromRecruiterName(move.getFrom().getName());
        dto.setToRecruiterId(move.getTo().getId());
        dto.setToRecruiterName(move.getTo().getName());
        dto.setCasesToMove(move.getCasesToMove());
        dto.setZoneMatch(move.isZoneMatch());
        dto.setFromZone(move.getFrom().getPrimaryZone().name());
        dto.setToZone(move.getTo().getPrimaryZone().name());
        return dto;
    }

    private static List<AssignmentDto> toAssignments(List<AssignmentView> views) {
        return views.stream().map(DtoMapper::toAssignment).collect(Collectors.toList());
    }

    private static AssignmentDto toAssignment(AssignmentView view) {
        Assignment assignment = view.getAssignment();
        AssignmentDto dto = new AssignmentDto();
        dto.setId(assignment.getId());
        dto.setPositionId(assignment.getPositionId());
        dto.setPositionTitle(view.getPositionTitle());
        dto.setPositionZone(view.getPositionZone() != null ? view.getPositionZone().name() : null);
        dto.setPositionPriority(view.getPositionPriority() != null ? view.getPositionPriority().name() : null);
        dto.setRecruiterId(assignment.getRecruiterId());
        dto.setRecruiterName(view.getRecruiterName());
        dto.setScore(assignment.getScore());
        dto.setScoreBreakdown(assignment.getBreakdown().toMap());
        dto.setExplanation(assignment.getExplanation());
        dto.setAssignmentType(assignment.getType().getValue());
        dto.setStatus(assignment.getStatus().getValue());
        dto.setCurrentStage(assignment.getCurrentStage());
        dto.setAssignedAt(assignment.getAssignedAt());
        dto.setReservationBatchId(assignment.getReservationBatchId());
        return dto;
    }

    private static AssignmentStatsDto toStats(AssignmentStats stats) {
        Map<String, Integer> byPriority = new LinkedHashMap<>();
        stats.getByPriority().forEach((tier, count) -> byPriority.put(tier.name(), count));

        AssignmentStatsDto dto = new AssignmentStatsDto();
        dto.setTotalAssigned(stats.getTotalAssigned());
        dto.setTotalFailed(stats.getTotalFailed());
        dto.setAverageScore(stats.getAverageScore());
        dto.setByPriority(byPriority);
        return dto;
    }
}
