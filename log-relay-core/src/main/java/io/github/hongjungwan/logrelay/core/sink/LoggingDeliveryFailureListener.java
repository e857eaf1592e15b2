package io.github.hongjungwan.logrelay.core.sink;

import io.github.hongjungwan.logrelay.api.domain.LogRecord;
import io.github.hongjungwan.logrelay.spi.DeliveryFailureListener;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 기본 실패 채널. 버려진 배치를 ERROR 로 기록한다.
 */
@Slf4j
public class LoggingDeliveryFailureListener implements DeliveryFailureListener {

    @Override
    public void onDeliveryFailed(String sinkName, String batchId, List<LogRecord> records, Throwable cause) {
        log.error("[{}] Delivery failed for batch {} ({} records): {}",
                sinkName, batchId, records.size(), cause == null ? "unknown" : cause.getMessage());
    }
}
