package io.github.hongjungwan.logrelay.api.config;

import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 전달 전 레코드 context 의 개인정보 scrub 설정.
 */
@Getter
@Builder
public class ScrubberConfig {

    /** 기본 규칙. 비밀값 제거, 이메일/전화번호 마스킹, 카드번호 등 해시, 이름/주소 부분 마스킹 */
    public static final List<ScrubRule> DEFAULT_RULES = List.of(
            ScrubRule.of(ScrubRule.Action.REDACT_FULL, 100, "Remove passwords and secrets completely",
                    "password", "passwd", "pwd", "secret", "token", "key", "apikey", "api_key"),
            new ScrubRule(ScrubRule.Action.MASK_EMAIL,
                    List.of("email", "e_mail", "emailAddress", "userEmail"),
                    List.of(Pattern.compile("email", Pattern.CASE_INSENSITIVE)),
                    90, "Mask email addresses"),
            new ScrubRule(ScrubRule.Action.MASK_PHONE,
                    List.of("phone", "phoneNumber", "mobile", "cell"),
                    List.of(Pattern.compile("phone", Pattern.CASE_INSENSITIVE)),
                    90, "Mask phone numbers"),
            ScrubRule.of(ScrubRule.Action.MASK_PARTIAL, 80, "Partially mask names and user identifiers",
                    "name", "firstName", "lastName", "fullName", "username", "userId"),
            ScrubRule.of(ScrubRule.Action.HASH_VALUE, 95, "Hash sensitive numeric identifiers",
                    "ssn", "socialSecurity", "creditCard", "cardNumber", "accountNumber"),
            ScrubRule.of(ScrubRule.Action.MASK_PARTIAL, 70, "Mask address information",
                    "address", "street", "city", "zipCode", "postalCode")
    );

    /** false 면 레코드를 그대로 전달 */
    @Builder.Default
    private final boolean enabled = false;

    @Builder.Default
    private final List<ScrubRule> rules = DEFAULT_RULES;

    /** 규칙에 걸리지 않은 중첩 Map/List 도 검사 */
    @Builder.Default
    private final boolean deepScrub = true;

    /** REDACT_FULL 대상이 숫자면 0 으로 (타입 유지) */
    @Builder.Default
    private final boolean preserveTypes = true;

    /** 중첩 검사 최대 깊이 */
    @Builder.Default
    private final int maxDepth = 10;
}
