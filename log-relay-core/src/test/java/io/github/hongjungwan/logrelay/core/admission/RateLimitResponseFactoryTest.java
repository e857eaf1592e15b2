package io.github.hongjungwan.logrelay.core.admission;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hongjungwan.logrelay.api.domain.RateLimitTier;
import io.github.hongjungwan.logrelay.api.http.RelayHeaders;
import io.github.hongjungwan.logrelay.core.ratelimit.IpBlockRecord;
import io.github.hongjungwan.logrelay.core.ratelimit.RateLimitCheckResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RateLimitResponseFactory 테스트")
class RateLimitResponseFactoryTest {

    private static final long NOW = 1_700_000_000_000L;

    private final RateLimitResponseFactory factory = new RateLimitResponseFactory();

    @Test
    @DisplayName("tier 초과는 backoff 와 rate limit 헤더를 담는다")
    void shouldBuildBackoffResponse() {
        RateLimitCheckResult result = new RateLimitCheckResult(
                false, RateLimitTier.APP, 30, 30, NOW + 12_500, 13, false, null);

        RateLimitResponse response = factory.create(result);

        assertThat(response.status()).isEqualTo(429);
        assertThat(response.headers())
                .containsEntry(RelayHeaders.RATE_LIMIT_LIMIT, "30")
                .containsEntry(RelayHeaders.RATE_LIMIT_REMAINING, "0")
                .containsEntry(RelayHeaders.RATE_LIMIT_RESET, String.valueOf((NOW + 13_000) / 1000))
                .containsEntry(RelayHeaders.RETRY_AFTER, "13")
                .containsEntry(RelayHeaders.ACTION, "backoff")
                .containsEntry(RelayHeaders.RATE_LIMIT_TIER, "app");
        assertThat(response.body().error()).isEqualTo(RateLimitResponseFactory.RATE_LIMIT_EXCEEDED);
        assertThat(response.body().blockInfo()).isNull();
    }

    @Test
    @DisplayName("global tier 초과는 pause")
    void shouldPauseOnGlobalTier() {
        RateLimitCheckResult result = new RateLimitCheckResult(
                false, RateLimitTier.GLOBAL, 10_000, 10_000, NOW + 1_000, 1, false, null);

        assertThat(factory.create(result).headers()).containsEntry(RelayHeaders.ACTION, "pause");
    }

    @Test
    @DisplayName("차단된 IP 는 block 과 차단 정보를 담는다")
    void shouldBlock() {
        IpBlockRecord block = new IpBlockRecord("192.0.2.1", 1, NOW + 300_000, 2, NOW);
        RateLimitCheckResult result = new RateLimitCheckResult(
                false, RateLimitTier.IP, 100, 0, NOW + 300_000, 300, true, block);

        RateLimitResponse response = factory.create(result);
        JsonNode body = new ObjectMapper().valueToTree(response.body());

        assertThat(response.headers()).containsEntry(RelayHeaders.ACTION, "block");
        assertThat(body.get("error").asText()).isEqualTo(RateLimitResponseFactory.IP_BLOCKED);
        assertThat(body.get("action").asText()).isEqualTo("block");
        assertThat(body.get("message").asText()).contains("level 1");
        assertThat(body.get("blockInfo").get("expiresAt").asLong()).isEqualTo(NOW + 300_000);
    }

    @Test
    @DisplayName("새로 차단이 생긴 거부도 block")
    void shouldBlockWhenViolationCreatedBlock() {
        IpBlockRecord block = new IpBlockRecord("192.0.2.1", 0, NOW + 60_000, 1, NOW);
        RateLimitCheckResult result = new RateLimitCheckResult(
                false, RateLimitTier.IP, 100, 100, NOW + 60_000, 60, false, block);

        assertThat(RateLimitResponseFactory.actionFor(result)).isEqualTo(AdmissionAction.BLOCK);
        assertThat(factory.create(result).body().error()).isEqualTo(RateLimitResponseFactory.RATE_LIMIT_EXCEEDED);
    }

    @Test
    @DisplayName("wire name 으로 action 을 찾는다")
    void shouldResolveActionFromWireName() {
        assertThat(AdmissionAction.fromWireName("BLOCK")).isEqualTo(AdmissionAction.BLOCK);
        assertThat(AdmissionAction.fromWireName("unknown")).isNull();
    }
}
