package io.github.hongjungwan.logrelay.core.admission;

import io.github.hongjungwan.logrelay.api.http.Headers;
import io.github.hongjungwan.logrelay.api.http.RelayHeaders;
import io.github.hongjungwan.logrelay.core.ratelimit.RateLimitIdentifier;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 요청 헤더와 연결 정보에서 rate limit 식별자 추출.
 *
 * <p>IP 우선순위: X-Forwarded-For 첫 값, 원격 주소, 그 외 프록시 헤더 순.
 * 유효한 IPv4/IPv6 문법이 아니면 {@link RateLimitIdentifier#UNKNOWN_IP}.</p>
 */
public class RateLimitIdentifierExtractor {

    private static final Pattern IPV4 = Pattern.compile(
            "^(?:(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)$");
    private static final Pattern IPV6 = Pattern.compile("^(?:[0-9a-fA-F]{1,4}:){7}[0-9a-fA-F]{1,4}$");

    private static final String FORWARDED_FOR = "x-forwarded-for";
    private static final List<String> FALLBACK_HEADERS = List.of(
            "cf-connecting-ip",
            "x-real-ip",
            "x-forwarded-for",
            "x-client-ip",
            "x-cluster-client-ip",
            "forwarded-for",
            "forwarded"
    );

    private final boolean trustForwardedHeaders;

    public RateLimitIdentifierExtractor(boolean trustForwardedHeaders) {
        this.trustForwardedHeaders = trustForwardedHeaders;
    }

    public RateLimitIdentifierExtractor() {
        this(true);
    }

    public RateLimitIdentifier extract(Headers headers, String remoteAddress) {
        return new RateLimitIdentifier(
                extractIp(headers, remoteAddress),
                headers.first(RelayHeaders.REPORTER_ID),
                headers.first(RelayHeaders.SOURCE)
        );
    }

    String extractIp(Headers headers, String remoteAddress) {
        if (trustForwardedHeaders) {
            String forwarded = normalize(headers.first(FORWARDED_FOR));
            if (isValidIp(forwarded)) {
                return forwarded;
            }
        }

        String remote = normalize(remoteAddress);
        if (isValidIp(remote)) {
            return remote;
        }

        if (trustForwardedHeaders) {
            for (String name : FALLBACK_HEADERS) {
                String candidate = normalize(stripForwardedSyntax(headers.first(name)));
                if (isValidIp(candidate)) {
                    return candidate;
                }
            }
        }
        return RateLimitIdentifier.UNKNOWN_IP;
    }

    public static boolean isValidIp(String ip) {
        return ip != null && (IPV4.matcher(ip).matches() || IPV6.matcher(ip).matches());
    }

    private static String normalize(String ip) {
        return ip == null ? null : ip.trim().toLowerCase(Locale.ROOT);
    }

    // RFC 7239: for=192.0.2.60;proto=http
    private static String stripForwardedSyntax(String value) {
        if (value == null) {
            return null;
        }
        int index = value.toLowerCase(Locale.ROOT).indexOf("for=");
        if (index < 0) {
            return value;
        }
        String rest = value.substring(index + 4);
        int end = rest.indexOf(';');
        String ip = end >= 0 ? rest.substring(0, end) : rest;
        return ip.replace("\"", "").trim();
    }
}
