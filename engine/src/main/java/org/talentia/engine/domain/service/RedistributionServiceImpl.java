package org.talentia.engine.domain.service;

import org.talentia.engine.domain.model.Recruiter;
import org.talentia.engine.domain.model.RedistributionMove;
import org.talentia.engine.domain.model.RedistributionPlan;
import org.talentia.engine.domain.model.Zone;
import org.talentia.engine.repository.RecruiterRepository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

public final class RedistributionServiceImpl implements RedistributionService {

    private static final Logger LOG = Logger.getLogger(RedistributionServiceImpl.class.getName());

    /** Load at which a recruiter counts as overloaded. */
    static final int OVERLOAD_THRESHOLD = 13;

    /** Loads below this leave room to take cases. */
    static final int AVAILABLE_THRESHOLD = 10;

    /** Load an overloaded recruiter is brought down to. */
    static final int TARGET_LOAD = 10;

    private final RecruiterRepository recruiterRepository;
    private final Messages messages;

    public RedistributionServiceImpl(RecruiterRepository recruiterRepository, Messages messages) {
        this.recruiterRepository = Objects.requireNonNull(recruiterRepository, "recruiterRepository must not be null");
        this.messages = Objects.requireNonNull(messages, "messages must not be null");
    }

    @Override
    public RedistributionPlan propose() {
        RedistributionPlan plan = plan(recruiterRepository.findActive());
        LOG.info(() -> String.format("Redistribution: %d overloaded, %d available, %d case(s) to move",
                plan.getOverloadedCount(), plan.getAvailableCount(), plan.getTotalCasesToMove()));
        return plan;
    }

    RedistributionPlan plan(List<Recruiter> recruiters) {
        List<Slot> overloaded = new ArrayList<>();
        List<Slot> available = new ArrayList<>();
        for (Recruiter recruiter : recruiters) {
            if (!recruiter.isEligible()) {
                continue;
            }
            if (recruiter.getCurrentLoad() >= OVERLOAD_THRESHOLD) {
                overloaded.add(new Slot(recruiter, recruiter.getCurrentLoad() - TARGET_LOAD));
            } else if (recruiter.getCurrentLoad() < AVAILABLE_THRESHOLD) {
                // A target never goes past its own capacity
                int room = Math.min(AVAILABLE_THRESHOLD, recruiter.getCapacity()) - recruiter.getCurrentLoad();
                if (room > 0) {
                    available.add(new Slot(recruiter, room));
                }
            }
        }

        if (overloaded.isEmpty()) {
            return new RedistributionPlan(true, Collections.emptyList(), 0, available.size(),
                    messages.get("redistribution.balanced"));
        }
        if (available.isEmpty()) {
            return new RedistributionPlan(false, Collections.emptyList(), overloaded.size(), 0,
                    messages.get("redistribution.no_capacity", overloaded.size()));
        }

        // Largest excess and largest room first; ties keep id order
        overloaded.sort(Comparator.comparingInt((Slot s) -> s.remaining).reversed());
        available.sort(Comparator.comparingInt((Slot s) -> s.remaining).reversed());

        List<RedistributionMove> moves = new ArrayList<>();
        for (Slot source : overloaded) {
            List<Slot> targets = available.stream()
                    .filter(t -> sharesZone(source.recruiter, t.recruiter))
                    .collect(Collectors.toCollection(ArrayList::new));
            available.stream()
                    .filter(t -> !sharesZone(source.recruiter, t.recruiter))
                    .forEach(targets::add);

            for (Slot target : targets) {
                if (source.remaining <= 0) {
                    break;
                }
                int cases = Math.min(source.remaining, target.remaining);
                if (cases <= 0) {
                    continue;
                }
                moves.add(new RedistributionMove(source.recruiter, target.recruiter, cases,
                        sharesZone(source.recruiter, target.recruiter)));
                source.remaining -= cases;
                target.remaining -= cases;
            }
        }

        int total = moves.stream().mapToInt(RedistributionMove::getCasesToMove).sum();
        return new RedistributionPlan(false, moves, overloaded.size(), available.size(),
                messages.get("redistribution.proposal", total, overloaded.size(), available.size()));
    }

    /**
     * Either recruiter's primary zone is among the other's zones.
     */
    static boolean sharesZone(Recruiter a, Recruiter b) {
        return zonesOf(a).contains(b.getPrimaryZone()) || zonesOf(b).contains(a.getPrimaryZone());
    }

    private static List<Zone> zonesOf(Recruiter recruiter) {
        List<Zone> zones = new ArrayList<>(recruiter.getSecondaryZones());
        zones.add(recruiter.getPrimaryZone());
        return zones;
    }

    // Remaining excess for a source, remaining room for a target
    private static final class Slot {
        private final Recruiter recruiter;
        private int remaining;

        private Slot(Recruiter recruiter, int remaining) {
            this.recruiter = recruiter;
            this.remaining = remaining;
        }
    }
}
