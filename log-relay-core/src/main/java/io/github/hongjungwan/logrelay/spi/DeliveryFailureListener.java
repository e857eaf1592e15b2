package io.github.hongjungwan.logrelay.spi;

import io.github.hongjungwan.logrelay.api.domain.LogRecord;

import java.util.List;

/**
 * 전달 실패 보고 채널. 재시도가 소진되어 버려진 배치를 운영 계층에 알린다.
 */
@FunctionalInterface
public interface DeliveryFailureListener {

    /**
     * @param sinkName 실패한 sink 이름
     * @param batchId  배치 ID (단일 레코드 전달이면 null)
     * @param records  버려진 레코드
     * @param cause    마지막 실패 원인
     */
    void onDeliveryFailed(String sinkName, String batchId, List<LogRecord> records, Throwable cause);
}
