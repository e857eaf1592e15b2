package io.github.hongjungwan.logrelay.api.config;

import lombok.Builder;
import lombok.Getter;

import java.time.ZoneId;
import java.util.Map;

/**
 * FileSink 설정. 파일명 템플릿 토큰: YYYY, MM, DD, HH.
 */
@Getter
@Builder
public class FileSinkConfig {

    /** 로그 디렉토리 */
    @Builder.Default
    private final String directory = "logs";

    /** 파일명 템플릿 */
    @Builder.Default
    private final String fileNameFormat = "YYYY-MM-DD.log";

    /** 파일 최대 크기 (bytes). 초과 시 rotation */
    @Builder.Default
    private final long maxSize = 10L * 1024 * 1024;

    /** 버퍼 flush 주기 (ms) */
    @Builder.Default
    private final long flushIntervalMs = 1_000;

    /** 버퍼 최대 크기 (bytes). 초과 시 즉시 flush */
    @Builder.Default
    private final long bufferMaxSize = 1024 * 1024;

    /** 파일명 날짜 토큰 계산용 타임존 */
    @Builder.Default
    private final ZoneId zoneId = ZoneId.systemDefault();

    /** 연속 쓰기 실패 허용 횟수. 초과 시 버퍼 폐기 후 실패 채널로 보고 */
    @Builder.Default
    private final int maxWriteRetries = 5;

    /** 모든 줄에 추가되는 고정 필드 */
    @Builder.Default
    private final Map<String, Object> additionalFields = Map.of();
}
