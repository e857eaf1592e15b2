package io.github.hongjungwan.logrelay.starter;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * log-relay 설정 Properties (prefix: log-relay).
 */
@Data
@ConfigurationProperties(prefix = "log-relay")
public class LogRelayProperties {

    /** relay 활성화 여부 */
    private boolean enabled = true;

    /** 애플리케이션 이름 (source 헤더, 루프 감지에 사용) */
    private String appName = "log-relay";

    private String appVersion = "unknown";

    /** 저장소 키 namespace */
    private String storageNamespace = "log-relay";

    /** 애플리케이션 자체 로그를 relay 로 보낼지 여부 (Logback root 에 appender 부착) */
    private boolean captureApplicationLogs = false;

    /** X-Forwarded-For 등 프록시 헤더를 신뢰할지 여부 */
    private boolean trustForwardedHeaders = true;

    /** 스케줄러 스레드 수 */
    private int schedulerThreads = 2;

    private RateLimitProperties rateLimit = new RateLimitProperties();

    private BatchProperties batch = new BatchProperties();

    private FileProperties file = new FileProperties();

    private HttpProperties http = new HttpProperties();

    private ScrubProperties scrub = new ScrubProperties();

    @Data
    public static class RateLimitProperties {
        private boolean enabled = true;
        private TierProperties global = new TierProperties(10_000, 60);
        private TierProperties ip = new TierProperties(100, 60);
        private TierProperties reporter = new TierProperties(50, 60);
        private TierProperties app = new TierProperties(30, 60);
        private BlockingProperties blocking = new BlockingProperties();

        /** 저장소 장애 시 요청 허용 여부 */
        private boolean failOpen = true;

        private long cleanupIntervalMs = 5 * 60 * 1000L;
    }

    @Data
    public static class TierProperties {
        private int limit;
        private int windowSeconds;

        public TierProperties() {
        }

        public TierProperties(int limit, int windowSeconds) {
            this.limit = limit;
            this.windowSeconds = windowSeconds;
        }
    }

    @Data
    public static class BlockingProperties {
        private boolean enabled = true;
        private int escalationResetHours = 24;

        /** 차단 단계별 시간 (초) */
        private List<Long> timeouts = new ArrayList<>(List.of(60L, 300L, 1800L));
    }

    @Data
    public static class BatchProperties {
        private boolean enabled = true;
        private int maxSize = 200;
        private long maxAgeMs = 15_000;
        private long sortingWindowMs = 3_000;
        private boolean retryOnFailure = true;
        private int maxRetries = 5;
        private long retryDelayMs = 10_000;

        /** 받을 레벨 (비어 있으면 전체) */
        private Set<Integer> levels;
    }

    @Data
    public static class FileProperties {
        private boolean enabled = true;
        private String directory = "logs";
        private String fileNameFormat = "YYYY-MM-DD.log";
        private long maxSize = 10L * 1024 * 1024;
        private long flushIntervalMs = 1_000;
        private long bufferMaxSize = 1024 * 1024;

        /** 각 줄에 추가되는 고정 필드 */
        private Map<String, Object> additionalFields = new LinkedHashMap<>();
    }

    @Data
    public static class HttpProperties {
        /** 전달 엔드포인트. 비어 있으면 HTTP 전달 미사용 */
        private String endpoint;
        private long timeoutMs = 30_000;
        private int maxRetries = 3;
        private long retryDelayMs = 1_000;
        private Map<String, String> headers = new LinkedHashMap<>();
    }

    @Data
    public static class ScrubProperties {
        /** 전달 전 context 개인정보 scrub 여부 */
        private boolean enabled = false;
        private boolean deepScrub = true;
        private boolean preserveTypes = true;
        private int maxDepth = 10;
        /** 기본 규칙에 더해 값 전체를 제거할 필드 이름 */
        private List<String> redactFields = new ArrayList<>();
    }
}
