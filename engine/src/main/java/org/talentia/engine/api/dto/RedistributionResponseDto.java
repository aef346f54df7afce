package org.talentia.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body for GET /recruiters/redistribution.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RedistributionResponseDto {

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("is_balanced")
    private boolean balanced;

    @JsonProperty("moves")
    private List<RedistributionMoveDto> moves;

    @JsonProperty("total_cases_to_move")
    private int totalCasesToMove;

    @JsonProperty("overloaded_count")
    private int overloadedCount;

    @JsonProperty("available_count")
    private int availableCount;

    @JsonProperty("message")
    private String message;

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public boolean isBalanced() {
        return balanced;
    }

    public void setBalanced(boolean balanced) {
        this.balanced = balanced;
    }

    public List<RedistributionMoveDto> getMoves() {
        return moves;
    }

    public void setMoves(List<RedistributionMoveDto> moves) {
        this.moves = moves;
    }

    public int getTotalCasesToMove() {
        return totalCasesToMove;
    }

    public void setTotalCasesToMove(int totalCasesToMove) {
        this.totalCasesToMove = totalCasesToMove;
    }

    public int getOverloadedCount() {
        return overloadedCount;
    }

    public void setOverloadedCount(int overloadedCount) {
        this.overloadedCount = overloadedCount;
    }

    public int getAvailableCount() {
        return availableCount;
    }

    public void setAvailableCount(int availableCount) {
        this.availableCount = availableCount;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
