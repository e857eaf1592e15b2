package io.github.hongjungwan.logrelay.api.http;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BiConsumer;

/**
 * 대소문자 구분 없는 읽기 전용 헤더 뷰. 헤더 조회는 모두 이 클래스를 거친다.
 */
public final class Headers {

    private static final Headers EMPTY = new Headers(Map.of());

    private final Map<String, String> values;

    private Headers(Map<String, String> source) {
        TreeMap<String, String> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        source.forEach((name, value) -> {
            if (name != null && value != null) {
                map.merge(name.trim(), value, (a, b) -> a + "," + b);
            }
        });
        this.values = Collections.unmodifiableMap(map);
    }

    public static Headers of(Map<String, String> source) {
        return source == null || source.isEmpty() ? EMPTY : new Headers(source);
    }

    public static Headers empty() {
        return EMPTY;
    }

    /** 헤더 원본 값. 없으면 null */
    public String get(String name) {
        return name == null ? null : values.get(name);
    }

    /** 쉼표로 구분된 값 중 첫 번째 (공백 제거). 없거나 비어 있으면 null */
    public String first(String name) {
        String value = get(name);
        if (value == null) {
            return null;
        }
        int comma = value.indexOf(',');
        String first = (comma >= 0 ? value.substring(0, comma) : value).trim();
        return first.isEmpty() ? null : first;
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public void forEach(BiConsumer<String, String> action) {
        values.forEach(action);
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "Headers" + values;
    }
}
