package org.talentia.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body for GET /assignments.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AssignmentListResponseDto {

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("data")
    private List<AssignmentDto> data;

    @JsonProperty("meta")
    private PageMetaDto meta;

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public List<AssignmentDto> getData() {
        return data;
    }

    public void setData(List<AssignmentDto> data) {
        this.data = data;
    }

    public PageMetaDto getMeta() {
        return meta;
    }

    public void setMeta(PageMetaDto meta) {
        this.meta = meta;
    }
}
