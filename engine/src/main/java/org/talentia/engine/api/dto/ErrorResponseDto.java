package org.talentia.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Error body shared by every endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ErrorResponseDto {

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("error")
    private String error;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("details")
    private Map<String, Object> details;

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public void setDetails(Map<String, Object> details) {
        this.details = details;
    }
}
