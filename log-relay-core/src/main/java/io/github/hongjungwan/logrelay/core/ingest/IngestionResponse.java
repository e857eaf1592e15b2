package io.github.hongjungwan.logrelay.core.ingest;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.hongjungwan.logrelay.api.http.RelayHeaders;
import io.github.hongjungwan.logrelay.core.admission.RateLimitResponse;

import java.util.List;
import java.util.Map;

/**
 * 수집 응답. body 는 JSON 으로 직렬화해 보내면 된다 (202 는 body 없음).
 */
public record IngestionResponse(int status, Map<String, String> headers, Object body) {

    public static final int ACCEPTED = 202;
    public static final int BAD_REQUEST = 400;

    public static final String INVALID_BATCH = "INVALID_BATCH";
    public static final String LOOP_DETECTED = "LOOP_DETECTED";

    public IngestionResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static IngestionResponse accepted() {
        return new IngestionResponse(ACCEPTED, Map.of(), null);
    }

    public static IngestionResponse badRequest(String error, String reason, List<String> details) {
        return new IngestionResponse(BAD_REQUEST,
                Map.of(RelayHeaders.CONTENT_TYPE, RelayHeaders.JSON_CONTENT_TYPE),
                new ErrorBody(error, reason, details == null || details.isEmpty() ? null : List.copyOf(details)));
    }

    public static IngestionResponse rateLimited(RateLimitResponse response) {
        return new IngestionResponse(response.status(), response.headers(), response.body());
    }

    public boolean isAccepted() {
        return status == ACCEPTED;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorBody(String error, String reason, List<String> details) {
    }
}
