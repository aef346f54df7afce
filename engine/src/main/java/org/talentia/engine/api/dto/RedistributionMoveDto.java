package org.talentia.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class RedistributionMoveDto {

    @JsonProperty("from_recruiter_id")
    private String fromRecruiterId;

    @JsonProperty("from_recruiter_name")
    private String fromRecruiterName;

    @JsonProperty("to_recruiter_id")
    private String toRecruiterId;

    @JsonProperty("to_recruiter_name")
    private String toRecruiterName;

    @JsonProperty("cases_to_move")
    private int casesToMove;

    @JsonProperty("zone_match")
    private boolean zoneMatch;

    @JsonProperty("from_zone")
    private String fromZone;

    @JsonProperty("to_zone")
    private String toZone;

    public String getFromRecruiterId() {
        return fromRecruiterId;
    }

    public void setFromRecruiterId(String fromRecruiterId) {
        this.fromRecruiterId = fromRecruiterId;
    }

    public String getFromRecruiterName() {
        return fromRecruiterName;
    }

    public void setFromRecruiterName(String fromRecruiterName) {
        this.fromRecruiterName = fromRecruiterName;
    }

    public String getToRecruiterId() {
        return toRecruiterId;
    }

    public void setToRecruiterId(String toRecruiterId) {
        this.toRecruiterId = toRecruiterId;
    }

    public String getToRecruiterName() {
        return toRecruiterName;
    }

    public void setToRecruiterName(String toRecruiterName) {
        this.toRecruiterName = toRecruiterName;
    }

    public int getCasesToMove() {
        return casesToMove;
    }

    public void setCasesToMove(int casesToMove) {
        this.casesToMove = casesToMove;
    }

    public boolean isZoneMatch() {
        return zoneMatch;
    }

    public void setZoneMatch(boolean zoneMatch) {
        this.zoneMatch = zoneMatch;
    }

    public String getFromZone() {
        return fromZone;
    }

    public void setFromZone(String fromZone) {
        this.fromZone = fromZone;
    }

    public String getToZone() {
        return toZone;
    }

    public void setToZone(String toZone) {
        this.toZone = toZone;
    }
}
