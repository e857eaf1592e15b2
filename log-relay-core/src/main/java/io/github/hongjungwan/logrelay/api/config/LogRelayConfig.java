package io.github.hongjungwan.logrelay.api.config;

import io.github.hongjungwan.logrelay.api.domain.AppInfo;
import lombok.Builder;
import lombok.Getter;

/**
 * relay 전체 설정. 서버 측 구성 요소 조립에 쓰인다.
 */
@Getter
@Builder
public class LogRelayConfig {

    /** 애플리케이션 이름 */
    @Builder.Default
    private final String appName = "log-relay";

    /** 애플리케이션 버전 */
    @Builder.Default
    private final String appVersion = "unknown";

    /** 저장소 키 namespace */
    @Builder.Default
    private final String storageNamespace = "log-relay";

    /** 파일 sink 사용 여부 */
    @Builder.Default
    private final boolean fileEnabled = true;

    @Builder.Default
    private final RateLimitConfig rateLimit = RateLimitConfig.builder().build();

    @Builder.Default
    private final BatchConfig batch = BatchConfig.builder().build();

    @Builder.Default
    private final FileSinkConfig file = FileSinkConfig.builder().build();

    /** HTTP 전달 설정. null 이면 HTTP sink 미사용 */
    private final HttpSinkConfig http;

    @Builder.Default
    private final LogQueueConfig queue = LogQueueConfig.builder().build();

    @Builder.Default
    private final ScrubberConfig scrub = ScrubberConfig.builder().build();

    public AppInfo appInfo() {
        return new AppInfo(appName, appVersion);
    }
}
