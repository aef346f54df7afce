package org.talentia.assignclient.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.ResponseBody;
import org.talentia.engine.api.JsonSupport;
import org.talentia.engine.api.dto.AssignmentBatchResponseDto;
import org.talentia.engine.api.dto.AssignmentListResponseDto;
import org.talentia.engine.api.dto.AssignmentRequestDto;
import org.talentia.engine.api.dto.ErrorResponseDto;
import org.talentia.engine.api.dto.PositionSuggestionsResponseDto;
import org.talentia.engine.api.dto.SuggestionsResponseDto;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.Body;
import retrofit2.http.GET;
import retrofit2.http.POST;
import retrofit2.http.Path;
import retrofit2.http.Query;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Retrofit-based implementation of AllocationApiClient.
 */
public final class AllocationApiClientImpl implements AllocationApiClient {

    private static final Logger LOG = Logger.getLogger(AllocationApiClientImpl.class.getName());

    private final AllocationApiService api;
    private final ObjectMapper mapper;

    public AllocationApiClientImpl(String baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");

        String normalizedUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .build();

        this.mapper = JsonSupport.objectMapper();
        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalizedUrl)
                .addConverterFactory(JacksonConverterFactory.create(mapper))
                .client(client)
                .build();

        this.api = retrofit.create(AllocationApiService.class);
    }

    @Override
    public boolean isHealthy() {
        try {
            Response<Void> response = api.health().execute();
            return response.isSuccessful();
        } catch (IOException e) {
            LOG.log(Level.FINE, "[API] GET /health error", e);
            return false;
        }
    }

    @Override
    public AssignmentBatchResponseDto assign(List<String> positionIds, boolean force) {
        if (positionIds == null || positionIds.isEmpty()) {
            throw new IllegalArgumentException("positionIds must not be empty");
        }
        AssignmentRequestDto request = new AssignmentRequestDto();
        if (positionIds.size() == 1) {
            request.setPositionId(positionIds.get(0));
        } else {
            request.setPositionIds(new ArrayList<>(positionIds));
        }
        request.setForce(force);
        return execute(api.assign(request), "POST /assignments");
    }

    @Override
    public AssignmentListResponseDto listAssignments(String positionId, String recruiterId, String status,
                                                     Integer page, Integer perPage) {
        return execute(api.listAssignments(positionId, recruiterId, status, page, perPage), "GET /assignments");
    }

    @Override
    public SuggestionsResponseDto getSuggestions(Integer limit, boolean interleave) {
        return execute(api.getSuggestions(limit, interleave ? Boolean.TRUE : null), "GET /positions/suggestions");
    }

    @Override
    public PositionSuggestionsResponseDto getSuggestions(String positionId, Integer k) {
        Objects.requireNonNull(positionId, "positionId must not be null");
        return execute(api.getPositionSuggestions(positionId, k), "GET /positions/{id}/suggestions");
    }

    /**
     * Execute a Retrofit call and return the body, or raise the engine's error.
     */
    private <T> T execute(Call<T> call, String description) {
        Response<T> response;
        try {
            response = call.execute();
        } catch (IOException e) {
            LOG.log(Level.WARNING, "[API] " + description + " error", e);
            throw new AllocationApiException(description + " failed: " + e.getMessage(), e);
        }
        if (response.isSuccessful()) {
            return response.body();
        }

        LOG.warning(() -> String.format("[API] %s failed: %d %s",
                description, response.code(), response.message()));
        ErrorResponseDto error = readError(response.errorBody());
        String message = error != null && error.getError() != null
                ? error.getError()
                : response.code() + " " + response.message();
        throw new AllocationApiException(response.code(), message, error != null ? error.getDetails() : null);
    }

    private ErrorResponseDto readError(ResponseBody body) {
        if (body == null) {
            return null;
        }
        try (ResponseBody closeable = body) {
            return mapper.readValue(closeable.string(), ErrorResponseDto.class);
        } catch (IOException e) {
            LOG.log(Level.FINE, "[API] unreadable error body", e);
            return null;
        }
    }

    /**
     * Retrofit service interface for the allocation API.
     */
    interface AllocationApiService {
        @GET("health")
        Call<Void> health();

        @POST("assignments")
        Call<AssignmentBatchResponseDto> assign(@Body AssignmentRequestDto request);

        @GET("assignments")
        Call<AssignmentListResponseDto> listAssignments(@Query("position_id") String positionId,
                                                        @Query("recruiter_id") String recruiterId,
                                                        @Query("status") String status,
                                                        @Query("page") Integer page,
                                                        @Query("per_page") Integer perPage);

        @GET("positions/suggestions")
        Call<SuggestionsResponseDto> getSuggestions(@Query("limit") Integer limit,
                                                    @Query("interleave") Boolean interleave);

        @GET("positions/{positionId}/suggestions")
        Call<PositionSuggestionsResponseDto> getPositionSuggestions(@Path("positionId") String positionId,
                                                                   @Query("k") Integer k);
    }
}
