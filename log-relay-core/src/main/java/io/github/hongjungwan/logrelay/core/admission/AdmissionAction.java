package io.github.hongjungwan.logrelay.core.admission;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 429 응답 시 클라이언트에 권장하는 동작.
 */
public enum AdmissionAction {

    /** 차단 만료 전까지 전송 중단 (요청을 버린다) */
    BLOCK("block"),

    /** 전체 한도 초과. 잠시 전송을 멈춘다 */
    PAUSE("pause"),

    /** 개별 한도 초과. backoff 후 재시도 */
    BACKOFF("backoff");

    private final String wireName;

    AdmissionAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static AdmissionAction fromWireName(String value) {
        for (AdmissionAction action : values()) {
            if (action.wireName.equalsIgnoreCase(value)) {
                return action;
            }
        }
        return null;
    }
}
