package org.talentia.assignclient.api;

import org.talentia.engine.api.dto.AssignmentBatchResponseDto;
import org.talentia.engine.api.dto.AssignmentListResponseDto;
import org.talentia.engine.api.dto.PositionSuggestionsResponseDto;
import org.talentia.engine.api.dto.SuggestionsResponseDto;

import java.util.List;

/**
 * Client for the allocation engine HTTP API.
 * Every call throws {@link AllocationApiException} when the engine answers
 * with an error or cannot be reached.
 */
public interface AllocationApiClient {

    /**
     * @return true if GET /health answers 200
     */
    boolean isHealthy();

    /**
     * Request automatic assignment. A single id is sent as {@code position_id},
     * several as {@code position_ids}.
     */
    AssignmentBatchResponseDto assign(List<String> positionIds, boolean force);

    /**
     * List assignments. Null arguments are left out of the query.
     */
    AssignmentListResponseDto listAssignments(String positionId, String recruiterId, String status,
                                              Integer page, Integer perPage);

    SuggestionsResponseDto getSuggestions(Integer limit, boolean interleave);

    PositionSuggestionsResponseDto getSuggestions(String positionId, Integer k);
}
