package org.talentia.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response body for GET /positions/{id}/suggestions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PositionSuggestionsResponseDto {

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("data")
    private PositionSuggestionsDto data;

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public PositionSuggestionsDto getData() {
        return data;
    }

    public void setData(PositionSuggestionsDto data) {
        this.data = data;
    }
}
