package org.talentia.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body for POST /assignments.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AssignmentRequestDto {

    @JsonProperty("position_id")
    private String positionId;

    @JsonProperty("position_ids")
    private List<String> positionIds;

    @JsonProperty("force")
    private boolean force;

    public String getPositionId() {
        return positionId;
    }

    public void setPositionId(String positionId) {
        this.positionId = positionId;
    }

    public List<String> getPositionIds() {
        return positionIds;
    }

    public void setPositionIds(List<String> positionIds) {
        this.positionIds = positionIds;
    }

    public boolean isForce() {
        return force;
    }

    public void setForce(boolean force) {
        this.force = force;
    }
}
