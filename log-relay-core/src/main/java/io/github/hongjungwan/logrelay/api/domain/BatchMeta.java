package io.github.hongjungwan.logrelay.api.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * 전송 배치 메타데이터. 이미 처리된 배치가 다시 수집되는 루프를 감지하는 데 쓰인다.
 *
 * @param processed    relay 를 이미 거친 배치인지 여부
 * @param processChain 배치를 처리한 reporter 인스턴스 ID 목록
 * @param source       원천 애플리케이션 이름
 * @param time         배치 생성 시각 (epoch millis)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BatchMeta(boolean processed, List<String> processChain, String source, long time) {

    public BatchMeta {
        processChain = processChain == null ? List.of() : List.copyOf(processChain);
    }
}
