package org.talentia.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * An assignment with its recruiter and position display fields.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AssignmentDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("position_id")
    private String positionId;

    @JsonProperty("position_title")
    private String positionTitle;

    @JsonProperty("position_zone")
    private String positionZone;

    @JsonProperty("position_priority")
    private String positionPriority;

    @JsonProperty("recruiter_id")
    private String recruiterId;

    @JsonProperty("recruiter_name")
    private String recruiterName;

    @JsonProperty("score")
    private double score;

    @JsonProperty("score_breakdown")
    private Map<String, Double> scoreBreakdown;

    @JsonProperty("explanation")
    private String explanation;

    @JsonProperty("assignment_type")
    private String assignmentType;

    @JsonProperty("status")
    private String status;

    @JsonProperty("current_stage")
    private String currentStage;

    @JsonProperty("assigned_at")
    private Instant assignedAt;

    @JsonProperty("reservation_batch_id")
    private String reservationBatchId;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getPositionId() {
        return positionId;
    }

    public void setPositionId(String positionId) {
        this.positionId = positionId;
    }

    public String getPositionTitle() {
        return positionTitle;
    }

    public void setPositionTitle(String positionTitle) {
        this.positionTitle = positionTitle;
    }

    public String getPositionZone() {
        return positionZone;
    }

    public void setPositionZone(String positionZone) {
        this.positionZone = positionZone;
    }

    public String getPositionPriority() {
        return positionPriority;
    }

    public void setPositionPriority(String positionPriority) {
        this.positionPriority = positionPriority;
    }

    public String getRecruiterId() {
        return recruiterId;
    }

    public void setRecruiterId(String recruiterId) {
        this.recruiterId = recruiterId;
    }

    public String getRecruiterName() {
        return recruiterName;
    }

    public void setRecruiterName(String recruiterName) {
        this.recruiterName = recruiterName;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public Map<String, Double> getScoreBreakdown() {
        return scoreBreakdown;
    }

    public void setScoreBreakdown(Map<String, Double> scoreBreakdown) {
        this.scoreBreakdown = scoreBreakdown;
    }

    public String getExplanation() {
        return explanation;
    }

    public void setExplanation(String explanation) {
        this.explanation = explanation;
    }

    public String getAssignmentType() {
        return assignmentType;
    }

    public void setAssignmentType(String assignmentType) {
        this.assignmentType = assignmentType;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getCurrentStage() {
        return currentStage;
    }

    public void setCurrentStage(String currentStage) {
        this.currentStage = currentStage;
    }

    public Instant getAssignedAt() {
        return assignedAt;
    }

    public void setAssignedAt(Instant assignedAt) {
        this.assignedAt = assignedAt;
    }

    public String getReservationBatchId() {
        return reservationBatchId;
    }

    public void setReservationBatchId(String reservationBatchId) {
        this.reservationBatchId = reservationBatchId;
    }
}
