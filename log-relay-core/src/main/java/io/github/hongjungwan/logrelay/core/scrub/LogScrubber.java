package io.github.hongjungwan.logrelay.core.scrub;

import io.github.hongjungwan.logrelay.api.config.ScrubRule;
import io.github.hongjungwan.logrelay.api.config.ScrubberConfig;
import io.github.hongjungwan.logrelay.api.domain.LogRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * 전달 전 레코드 context 의 개인정보 필드를 규칙에 따라 제거/마스킹/해시한다.
 *
 * <p>필드 이름으로 규칙을 찾는다. 정확 일치 (대소문자 무시) 가 정규식보다 우선하고,
 * 같은 이름이 여러 규칙에 있으면 priority 가 높은 규칙이 이긴다.
 * 레코드는 불변이므로 변경이 있으면 새 레코드를 돌려준다.</p>
 */
@Slf4j
public class LogScrubber {

    static final String REDACTED = "[REDACTED]";

    private final ScrubberConfig config;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<ScrubRule> rules;
    private volatile RuleIndex index;

    private final AtomicLong totalProcessed = new AtomicLong();
    private final AtomicLong totalScrubbed = new AtomicLong();

    public LogScrubber(ScrubberConfig config) {
        this.config = config;
        this.rules = new ArrayList<>(config.getRules());
        this.index = RuleIndex.of(rules);
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    public LogRecord scrub(LogRecord record) {
        if (!config.isEnabled() || record == null) {
            return record;
        }
        totalProcessed.incrementAndGet();
        if (record.getContext().isEmpty()) {
            return record;
        }
        List<String> modified = new ArrayList<>();
        Map<String, Object> scrubbed = scrubMap(record.getContext(), "", 0, index, modified);
        if (modified.isEmpty()) {
            return record;
        }
        totalScrubbed.incrementAndGet();
        log.trace("Scrubbed fields {}", modified);
        return record.toBuilder().context(scrubbed).build();
    }

    public List<LogRecord> scrubAll(List<LogRecord> records) {
        if (!config.isEnabled() || records == null) {
            return records;
        }
        List<LogRecord> result = new ArrayList<>(records.size());
        for (LogRecord record : records) {
            result.add(scrub(record));
        }
        return result;
    }

    /**
     * @return 이 필드 이름에 적용될 규칙
     */
    public Optional<ScrubRule> ruleFor(String fieldName) {
        return Optional.ofNullable(index.find(fieldName));
    }

    public void addRule(ScrubRule rule) {
        lock.lock();
        try {
            rules.add(rule);
            index = RuleIndex.of(rules);
        } finally {
            lock.unlock();
        }
    }

    public void removeRule(String description) {
        lock.lock();
        try {
            rules.removeIf(rule -> rule.description() != null && rule.description().equals(description));
            index = RuleIndex.of(rules);
        } finally {
            lock.unlock();
        }
    }

    public Stats getStats() {
        long processed = totalProcessed.get();
        long scrubbed = totalScrubbed.get();
        return new Stats(processed, scrubbed, processed > 0 ? (double) scrubbed / processed : 0);
    }

    public void resetStats() {
        totalProcessed.set(0);
        totalScrubbed.set(0);
    }

    private Map<String, Object> scrubMap(Map<?, ?> map, String path, int depth, RuleIndex rules,
                                         List<String> modified) {
        Map<String, Object> result = new LinkedHashMap<>(map.size());
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            result.put(key, scrubEntry(key, entry.getValue(), path, depth, rules, modified));
        }
        return result;
    }

    private Object scrubEntry(String key, Object value, String path, int depth, RuleIndex rules,
                              List<String> modified) {
        ScrubRule rule = rules.find(key);
        if (rule != null) {
            Object replaced = apply(value, rule.action());
            if (!Objects.equals(replaced, value)) {
                modified.add(path + key);
            }
            return replaced;
        }
        if (!config.isDeepScrub() || depth >= config.getMaxDepth()) {
            return value;
        }
        if (value instanceof Map) {
            return scrubMap((Map<?, ?>) value, path + key + ".", depth + 1, rules, modified);
        }
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            List<Object> items = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                items.add(scrubEntry(String.valueOf(i), list.get(i), path + key + ".", depth + 1, rules, modified));
            }
            return items;
        }
        return value;
    }

    Object apply(Object value, ScrubRule.Action action) {
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value);
        switch (action) {
            case REDACT_FULL:
                return config.isPreserveTypes() && value instanceof Number ? 0 : REDACTED;
            case MASK_FIRST_ONLY:
                return text.length() <= 1 ? "*" : text.charAt(0) + "*".repeat(text.length() - 1);
            case MASK_PARTIAL:
                return maskPartial(text);
            case HASH_VALUE:
                return hash(text);
            case MASK_EMAIL:
                return maskEmail(text);
            case MASK_PHONE:
                return maskPhone(text);
            default:
                return value;
        }
    }

    static String maskPartial(String value) {
        if (value.length() < 2) {
            return "*";
        }
        if (value.length() < 7) {
            return value.charAt(0) + "*".repeat(value.length() - 1);
        }
        return value.charAt(0) + "*****" + value.charAt(value.length() - 1);
    }

    static String maskEmail(String value) {
        int at = value.indexOf('@');
        if (at <= 0 || at == value.length() - 1) {
            return value;
        }
        String domain = value.substring(at + 1);
        if (at == 1) {
            return "*@" + domain;
        }
        return value.charAt(0) + "***@" + domain;
    }

    static String maskPhone(String value) {
        int digits = 0;
        for (int i = 0; i < value.length(); i++) {
            if (Character.isDigit(value.charAt(i))) {
                digits++;
            }
        }
        if (digits < 4) {
            return value;
        }
        StringBuilder masked = new StringBuilder(value.length());
        int seen = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isDigit(c)) {
                masked.append(seen == 0 || seen == digits - 1 ? c : '*');
                seen++;
            } else {
                masked.append(c);
            }
        }
        return masked.toString();
    }

    // 31 배수 문자열 해시. 같은 입력은 항상 같은 값이라 레코드 간 대조는 가능하다
    static String hash(String value) {
        return "[HASH:" + Long.toHexString(Math.abs((long) value.hashCode())) + "]";
    }

    /**
     * @param totalProcessed 검사한 레코드 수
     * @param totalScrubbed  한 필드 이상 바뀐 레코드 수
     * @param scrubRate      totalScrubbed / totalProcessed
     */
    public record Stats(long totalProcessed, long totalScrubbed, double scrubRate) {
    }

    private static final class RuleIndex {
        private final Map<String, ScrubRule> byName;
        private final List<Map.Entry<Pattern, ScrubRule>> byPattern;

        private RuleIndex(Map<String, ScrubRule> byName, List<Map.Entry<Pattern, ScrubRule>> byPattern) {
            this.byName = byName;
            this.byPattern = byPattern;
        }

        static RuleIndex of(List<ScrubRule> rules) {
            List<ScrubRule> sorted = new ArrayList<>(rules);
            sorted.sort(Comparator.comparingInt(ScrubRule::priority).reversed());
            Map<String, ScrubRule> byName = new HashMap<>();
            List<Map.Entry<Pattern, ScrubRule>> byPattern = new ArrayList<>();
            for (ScrubRule rule : sorted) {
                for (String name : rule.fieldNames()) {
                    byName.putIfAbsent(name.toLowerCase(Locale.ROOT), rule);
                }
                for (Pattern pattern : rule.fieldPatterns()) {
                    byPattern.add(Map.entry(pattern, rule));
                }
            }
            return new RuleIndex(byName, List.copyOf(byPattern));
        }

        ScrubRule find(String fieldName) {
            if (fieldName == null) {
                return null;
            }
            ScrubRule exact = byName.get(fieldName.toLowerCase(Locale.ROOT));
            if (exact != null) {
                return exact;
            }
            for (Map.Entry<Pattern, ScrubRule> entry : byPattern) {
                if (entry.getKey().matcher(fieldName).find()) {
                    return entry.getValue();
                }
            }
            return null;
        }
    }
}
