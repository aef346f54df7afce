package org.talentia.engine.domain.model;

/**
 * Optional criteria and paging for listing assignments.
 */
public final class AssignmentFilter {

    public static final int DEFAULT_PER_PAGE = 50;
    public static final int MAX_PER_PAGE = 200;

    private final String positionId;
    private final String recruiterId;
    private final AssignmentStatus status;
    private final int page;
    private final int perPage;

    public AssignmentFilter(String positionId, String recruiterId, AssignmentStatus status, int page, int perPage) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be at least 1");
        }
        if (perPage < 1 || perPage > MAX_PER_PAGE) {
            throw new IllegalArgumentException("per_page must be between 1 and " + MAX_PER_PAGE);
        }
        this.positionId = positionId;
        this.recruiterId = recruiterId;
        this.status = status;
        this.page = page;
        this.perPage = perPage;
    }

    public static AssignmentFilter all() {
        return new AssignmentFilter(null, null, null, 1, DEFAULT_PER_PAGE);
    }

    public String getPositionId() {
        return positionId;
    }

    public String getRecruiterId() {
        return recruiterId;
    }

    public AssignmentStatus getStatus() {
        return status;
    }

    public int getPage() {
        return page;
    }

    public int getPerPage() {
        return perPage;
    }

    public int offset() {
        return (page - 1) * perPage;
    }
}
