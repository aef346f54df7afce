package org.talentia.engine.domain.service;

import org.talentia.engine.domain.model.PositionSuggestions;

import java.util.List;

/**
 * Read-only recruiter suggestions for positions. Never reserves capacity.
 */
public interface SuggestionService {

    /**
     * Active positions, most urgent first, each with its top suggested recruiters.
     *
     * @param limit maximum number of positions
     * @param interleave order by queue in a 2:1:1 ratio instead of pure priority
     */
    List<PositionSuggestions> suggestAll(int limit, boolean interleave);

    /**
     * Top-K suggestions for one position.
     *
     * @throws org.talentia.engine.domain.error.NotFoundException if the position does not exist
     */
    PositionSuggestions suggestFor(String positionId, int k);
}
