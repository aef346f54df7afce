package org.talentia.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Response body for GET /positions/suggestions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SuggestionsResponseDto {

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("data")
    private List<PositionSuggestionsDto> data;

    @JsonProperty("queues")
    private Map<String, Integer> queues;

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public List<PositionSuggestionsDto> getData() {
        return data;
    }

    public void setData(List<PositionSuggestionsDto> data) {
        this.data = data;
    }

    public Map<String, Integer> getQueues() {
        return queues;
    }

    public void setQueues(Map<String, Integer> queues) {
        this.queues = queues;
    }
}
