package io.github.hongjungwan.logrelay.api.domain;

/**
 * rate limit 차원. 검사 순서는 선언 순서와 같다 (global → ip → reporter → app).
 */
public enum RateLimitTier {

    GLOBAL("global"),
    IP("ip"),
    REPORTER("reporter"),
    APP("app");

    private final String wireName;

    RateLimitTier(String wireName) {
        this.wireName = wireName;
    }

    /** 저장 키와 응답 헤더에 쓰이는 소문자 이름 */
    public String wireName() {
        return wireName;
    }
}
