package io.github.hongjungwan.logrelay.core.sink;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * 날짜 토큰 파일명 템플릿. YYYY, MM, DD, HH 를 flush 시각 기준으로 치환한다.
 */
public final class FileNameTemplate {

    private final String pattern;
    private final ZoneId zoneId;

    public FileNameTemplate(String pattern, ZoneId zoneId) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("fileNameFormat must not be blank");
        }
        this.pattern = pattern;
        this.zoneId = zoneId;
    }

    public String resolve(long epochMillis) {
        ZonedDateTime time = Instant.ofEpochMilli(epochMillis).atZone(zoneId);
        return pattern
                .replace("YYYY", String.valueOf(time.getYear()))
                .replace("MM", pad(time.getMonthValue()))
                .replace("DD", pad(time.getDayOfMonth()))
                .replace("HH", pad(time.getHour()));
    }

    /** rotation 된 파일명: 확장자 앞에 -{epochMillis} 삽입 */
    public static String rotatedName(String fileName, long epochMillis) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return fileName + "-" + epochMillis;
        }
        return fileName.substring(0, dot) + "-" + epochMillis + fileName.substring(dot);
    }

    private static String pad(int value) {
        return value < 10 ? "0" + value : String.valueOf(value);
    }

    @Override
    public String toString() {
        return pattern;
    }
}
