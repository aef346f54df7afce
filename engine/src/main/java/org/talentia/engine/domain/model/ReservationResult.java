package org.talentia.engine.domain.model;

import java.util.Objects;

/**
 * Per-recruiter outcome of a batch capacity reservation.
 * A rejected reservation leaves the recruiter's load unchanged; newLoad is -1
 * when the recruiter does not exist.
 */
public final class ReservationResult {

    private final String recruiterId;
    private final int increment;
    private final boolean success;
    private final int newLoad;

    public ReservationResult(String recruiterId, int increment, boolean success, int newLoad) {
        this.recruiterId = Objects.requireNonNull(recruiterId, "recruiterId must not be null");
        this.increment = increment;
        this.success = success;
        this.newLoad = newLoad;
    }

    public String getRecruiterId() {
        return recruiterId;
    }

    public int getIncrement() {
        return increment;
    }

    public boolean isSuccess() {
        return success;
    }

    public int getNewLoad() {
        return newLoad;
    }

    @Override
    public String toString() {
        return String.format("ReservationResult{recruiterId='%s', increment=%d, success=%s, newLoad=%d}",
                recruiterId, increment, success, newLoad);
    }
}
