package org.talentia.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class AssignmentStatsDto {

    @JsonProperty("total_assigned")
    private int totalAssigned;

    @JsonProperty("total_failed")
    private int totalFailed;

    @JsonProperty("average_score")
    private double averageScore;

    @JsonProperty("by_priority")
    private Map<String, Integer> byPriority;

    public int getTotalAssigned() {
        return totalAssigned;
    }

    public void setTotalAssigned(int totalAssigned) {
        this.totalAssigned = totalAssigned;
    }

    public int getTotalFailed() {
        return totalFailed;
    }

    public void setTotalFailed(int totalFailed) {
        this.totalFailed = totalFailed;
    }

    public double getAverageScore() {
        return averageScore;
    }

    public void setAverageScore(double averageScore) {
        this.averageScore = averageScore;
    }

    public Map<String, Integer> getByPriority() {
        return byPriority;
    }

    public void setByPriority(Map<String, Integer> byPriority) {
        this.byPriority = byPriority;
    }
}
