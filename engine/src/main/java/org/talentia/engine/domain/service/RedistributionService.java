package org.talentia.engine.domain.service;

import org.talentia.engine.domain.model.RedistributionPlan;

/**
 * Proposes moving cases from overloaded recruiters to recruiters with room.
 * Never changes any load.
 */
public interface RedistributionService {

    RedistributionPlan propose();
}
