package io.github.hongjungwan.logrelay.api.config;

import lombok.Builder;
import lombok.Getter;

/**
 * LogQueue 설정.
 */
@Getter
@Builder
public class LogQueueConfig {

    /** false 면 레코드마다 즉시 전송 */
    @Builder.Default
    private final boolean batchingEnabled = true;

    /** 한 번에 보내는 레코드 수 임계치 */
    @Builder.Default
    private final int maxBatchSize = 10;

    /** 첫 레코드 이후 전송까지 최대 대기 (ms) */
    @Builder.Default
    private final long maxBatchAgeMs = 3_000;

    /** 큐 최대 길이. 초과 시 오래된 레코드부터 버린다 */
    @Builder.Default
    private final int maxQueueSize = 1_000;
}
