package io.github.hongjungwan.logrelay.core.admission;

import io.github.hongjungwan.logrelay.api.domain.BatchMeta;
import io.github.hongjungwan.logrelay.api.domain.LogBatch;
import io.github.hongjungwan.logrelay.api.http.Headers;
import io.github.hongjungwan.logrelay.api.http.RelayHeaders;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 이미 relay 를 거친 배치가 다시 수집되는 루프 감지.
 */
public class LoopDetector {

    static final long STALE_WARNING_MS = 5 * 60 * 1000L;
    static final long STALE_LOOP_MS = 10 * 60 * 1000L;

    private final String appName;

    /**
     * @param appName 이 relay 의 앱 이름. 같은 이름의 source 로 들어온 요청은 자기 자신에게 되돌아온 것으로 본다
     */
    public LoopDetector(String appName) {
        this.appName = appName;
    }

    public LoopDetector() {
        this(null);
    }

    public Result check(Headers headers, LogBatch batch, long now) {
        List<String> reasons = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        // relay 간 전달에도 붙는 표시라 경고만
        if ("true".equalsIgnoreCase(headers.first(RelayHeaders.PROCESSED))) {
            warnings.add("request carries " + RelayHeaders.PROCESSED + " marker");
        }
        String source = headers.first(RelayHeaders.SOURCE);
        if (appName != null && headers.contains(RelayHeaders.REPORTER_ID) && appName.equals(source)) {
            reasons.add("logs are coming from this application (" + source + ")");
        }

        BatchMeta meta = batch.meta();
        if (meta != null) {
            if (meta.processed() && hasDuplicate(meta.processChain())) {
                reasons.add("process chain revisits a reporter: " + meta.processChain());
            }
            if (meta.time() > 0) {
                long age = now - meta.time();
                if (age > STALE_LOOP_MS) {
                    reasons.add("batch is " + age / 1000 + "s old");
                } else if (age > STALE_WARNING_MS) {
                    warnings.add("batch is " + age / 1000 + "s old");
                }
            }
        }
        return new Result(!reasons.isEmpty(), List.copyOf(reasons), List.copyOf(warnings));
    }

    private static boolean hasDuplicate(List<String> chain) {
        Set<String> seen = new HashSet<>();
        for (String id : chain) {
            if (!seen.add(id)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param loop     거부해야 하는 루프 여부
     * @param reasons  루프 판정 사유
     * @param warnings 허용하되 기록할 경고
     */
    public record Result(boolean loop, List<String> reasons, List<String> warnings) {
    }
}
