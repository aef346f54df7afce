package org.talentia.assignclient;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.talentia.assignclient.api.AllocationApiClient;
import org.talentia.assignclient.api.AllocationApiException;
import org.talentia.engine.api.dto.AssignmentBatchResponseDto;
import org.talentia.engine.api.dto.AssignmentDto;
import org.talentia.engine.api.dto.AssignmentListResponseDto;
import org.talentia.engine.api.dto.PageMetaDto;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AssignClientAppTest {

    @Mock
    private AllocationApiClient api;

    private ByteArrayOutputStream buffer;
    private AssignClientApp app;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        app = new AssignClientApp(api, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @Test
    void assignPrintsMessageAssignmentsAndWarning() {
        AssignmentBatchResponseDto response = new AssignmentBatchResponseDto();
        response.setMessage("1 position(s) assigned. 1 not assigned due to recruiter capacity.");
        response.setData(Collections.singletonList(assignment("p-1", "r-a", "Ana")));
        response.setWarning("1 position(s) left unassigned: recruiters without capacity (r-b).");
        when(api.assign(Arrays.asList("p-1", "p-2"), true)).thenReturn(response);

        int code = app.run(new String[]{"assign", "p-1", "--force", "p-2"});

        assertThat(code).isEqualTo(AssignClientApp.EXIT_OK);
        assertThat(output())
                .contains("1 position(s) assigned")
                .contains("p-1 -> r-a (Ana) score=0.8600 status=assigned")
                .contains("Warning: 1 position(s) left unassigned");
    }

    @Test
    void listForwardsFilters() {
        PageMetaDto meta = new PageMetaDto();
        meta.setTotal(7);
        meta.setPage(2);
        meta.setPerPage(5);
        AssignmentListResponseDto response = new AssignmentListResponseDto();
        response.setData(Collections.singletonList(assignment("p-3", "r-b", "Bruno")));
        response.setMeta(meta);
        when(api.listAssignments(null, "r-b", null, 2, 5)).thenReturn(response);

        int code = app.run(new String[]{"list", "--recruiter", "r-b", "--page", "2", "--per-page", "5"});

        assertThat(code).isEqualTo(AssignClientApp.EXIT_OK);
        assertThat(output()).contains("Page 2, 1 of 7 assignment(s)");
    }

    @Test
    void apiErrorsExitWithOne() {
        when(api.assign(anyList(), anyBoolean())).thenThrow(new AllocationApiException(409,
                "This position is already assigned.", Collections.<String, Object>singletonMap("status", "in_progress")));

        int code = app.run(new String[]{"assign", "p-1"});

        assertThat(code).isEqualTo(AssignClientApp.EXIT_API_ERROR);
        assertThat(output()).contains("Error (409): This position is already assigned.")
                .contains("Details: {status=in_progress}");
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertThat(app.run(new String[0])).isEqualTo(AssignClientApp.EXIT_USAGE);
        assertThat(app.run(new String[]{"assign"})).isEqualTo(AssignClientApp.EXIT_USAGE);
        assertThat(app.run(new String[]{"list", "--page", "two"})).isEqualTo(AssignClientApp.EXIT_USAGE);
        assertThat(app.run(new String[]{"explode"})).isEqualTo(AssignClientApp.EXIT_USAGE);
        assertThat(output()).contains("Usage:");
        verifyNoInteractions(api);
    }

    @Test
    void healthReportsAvailability() {
        when(api.isHealthy()).thenReturn(false);

        assertThat(app.run(new String[]{"health"})).isEqualTo(AssignClientApp.EXIT_API_ERROR);
        assertThat(output()).contains("unavailable");
        verify(api).isHealthy();
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static AssignmentDto assignment(String positionId, String recruiterId, String recruiterName) {
        AssignmentDto dto = new AssignmentDto();
        dto.setPositionId(positionId);
        dto.setRecruiterId(recruiterId);
        dto.setRecruiterName(recruiterName);
        dto.setScore(0.86);
        dto.setStatus("assigned");
        return dto;
    }
}
