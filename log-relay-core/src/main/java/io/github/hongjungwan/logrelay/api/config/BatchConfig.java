package io.github.hongjungwan.logrelay.api.config;

import lombok.Builder;
import lombok.Getter;

import java.util.Set;

/**
 * BatchReporter 설정.
 */
@Getter
@Builder
public class BatchConfig {

    /** false 면 서버 큐가 BatchReporter 없이 sink 로 바로 전달 */
    @Builder.Default
    private final boolean enabled = true;

    /** 버퍼 크기 임계치. 도달 시 즉시 flush 시도 */
    @Builder.Default
    private final int maxSize = 200;

    /** 마지막 flush 이후 최대 대기 시간 (ms) */
    @Builder.Default
    private final long maxAgeMs = 15_000;

    /** 정렬 대기 시간 (ms). 이보다 오래된 레코드만 flush 대상 */
    @Builder.Default
    private final long sortingWindowMs = 3_000;

    /** 전송 실패 시 재시도 여부 */
    @Builder.Default
    private final boolean retryOnFailure = true;

    /** 최대 재시도 횟수 */
    @Builder.Default
    private final int maxRetries = 5;

    /** 첫 재시도 지연 (ms). 이후 2배씩 증가 */
    @Builder.Default
    private final long retryDelayMs = 10_000;

    /** 버퍼에 받을 레벨 목록. null 이면 전체 허용 */
    private final Set<Integer> levels;
}
