package io.github.hongjungwan.logrelay.core.ratelimit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * IP 차단 기록.
 *
 * @param ip            차단된 IP
 * @param level         차단 단계 (timeout 목록 index)
 * @param expiresAt     차단 만료 시각 (epoch millis)
 * @param violations    누적 위반 횟수
 * @param lastViolation 마지막 위반 시각 (epoch millis)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IpBlockRecord(String ip, int level, long expiresAt, int violations, long lastViolation) {

    public boolean isActive(long now) {
        return expiresAt > now;
    }
}
