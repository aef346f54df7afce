package org.talentia.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body for a successful POST /assignments.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AssignmentBatchResponseDto {

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("batch_id")
    private String batchId;

    @JsonProperty("state")
    private String state;

    @JsonProperty("data")
    private List<AssignmentDto> data;

    @JsonProperty("stats")
    private AssignmentStatsDto stats;

    @JsonProperty("message")
    private String message;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("warning")
    private String warning;

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getBatchId() {
        return batchId;
    }

    public void setBatchId(String batchId) {
        this.batchId = batchId;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public List<AssignmentDto> getData() {
        return data;
    }

    public void setData(List<AssignmentDto> data) {
        this.data = data;
    }

    public AssignmentStatsDto getStats() {
        return stats;
    }

    public void setStats(AssignmentStatsDto stats) {
        this.stats = stats;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getWarning() {
        return warning;
    }

    public void setWarning(String warning) {
        this.warning = warning;
    }
}
