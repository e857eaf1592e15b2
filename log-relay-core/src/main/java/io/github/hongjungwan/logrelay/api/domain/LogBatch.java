package io.github.hongjungwan.logrelay.api.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 전송 단위 배치. 수집 엔드포인트의 요청 본문 형식과 같다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LogBatch(List<LogRecord> logs, AppInfo app, BatchMeta meta) {

    public static LogBatch of(List<LogRecord> logs, AppInfo app) {
        return new LogBatch(logs, app, null);
    }

    public int size() {
        return logs == null ? 0 : logs.size();
    }
}
