package org.talentia.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A position with its priority and the recruiters suggested for it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PositionSuggestionsDto {

    @JsonProperty("position_id")
    private String positionId;

    @JsonProperty("title")
    private String title;

    @JsonProperty("zone")
    private String zone;

    @JsonProperty("priority")
    private String priority;

    @JsonProperty("status")
    private String status;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("recruiter_id")
    private String recruiterId;

    @JsonProperty("priority_score")
    private double priorityScore;

    @JsonProperty("queue")
    private String queue;

    @JsonProperty("overdue_days")
    private double overdueDays;

    @JsonProperty("priority_explanation")
    private String priorityExplanation;

    @JsonProperty("suggestions")
    private List<SuggestedRecruiterDto> suggestions;

    public String getPositionId() {
        return positionId;
    }

    public void setPositionId(String positionId) {
        this.positionId = positionId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public String getPriority() {
        return priority;
    }

    public void setPriority(String priority) {
        this.priority = priority;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getRecruiterId() {
        return recruiterId;
    }

    public void setRecruiterId(String recruiterId) {
        this.recruiterId = recruiterId;
    }

    public double getPriorityScore() {
        return priorityScore;
    }

    public void setPriorityScore(double priorityScore) {
        this.priorityScore = priorityScore;
    }

    public String getQueue() {
        return queue;
    }

    public void setQueue(String queue) {
        this.queue = queue;
    }

    public double getOverdueDays() {
        return overdueDays;
    }

    public void setOverdueDays(double overdueDays) {
        this.overdueDays = overdueDays;
    }

    public String getPriorityExplanation() {
        return priorityExplanation;
    }

    public void setPriorityExplanation(String priorityExplanation) {
        this.priorityExplanation = priorityExplanation;
    }

    public List<SuggestedRecruiterDto> getSuggestions() {
        return suggestions;
    }

    public void setSuggestions(List<SuggestedRecruiterDto> suggestions) {
        this.suggestions = suggestions;
    }
}
