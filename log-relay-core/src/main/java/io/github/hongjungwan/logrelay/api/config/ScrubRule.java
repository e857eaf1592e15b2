package io.github.hongjungwan.logrelay.api.config;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 컨텍스트 필드 이름에 대한 scrub 규칙. 이름은 대소문자 무시 정확 일치, 패턴은 부분 일치로 비교한다.
 *
 * @param action        적용할 처리
 * @param fieldNames    정확히 일치시킬 필드 이름
 * @param fieldPatterns 필드 이름 정규식
 * @param priority      높을수록 먼저 적용
 * @param description   규칙 설명. 규칙 제거 시 식별자로 쓰인다
 */
public record ScrubRule(Action action, List<String> fieldNames, List<Pattern> fieldPatterns,
                        int priority, String description) {

    public ScrubRule {
        Objects.requireNonNull(action, "action");
        fieldNames = fieldNames == null ? List.of() : List.copyOf(fieldNames);
        fieldPatterns = fieldPatterns == null ? List.of() : List.copyOf(fieldPatterns);
    }

    public static ScrubRule of(Action action, int priority, String description, String... fieldNames) {
        return new ScrubRule(action, List.of(fieldNames), List.of(), priority, description);
    }

    public enum Action {
        /** 값 전체를 "[REDACTED]" 로 (숫자는 타입 유지 시 0) */
        REDACT_FULL,
        /** 첫 글자만 남김 */
        MASK_FIRST_ONLY,
        /** 첫 글자와 마지막 글자만 남김 (7자 미만은 첫 글자만) */
        MASK_PARTIAL,
        /** "[HASH:hex]" 로 치환 */
        HASH_VALUE,
        /** local part 첫 글자만 남김: john@example.com -> j***@example.com */
        MASK_EMAIL,
        /** 첫 숫자와 마지막 숫자만 남김 */
        MASK_PHONE
    }
}
