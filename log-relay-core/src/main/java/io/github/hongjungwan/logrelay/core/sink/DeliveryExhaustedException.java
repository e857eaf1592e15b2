package io.github.hongjungwan.logrelay.core.sink;

/**
 * 재시도를 모두 소진해 배치를 전달하지 못함.
 */
public class DeliveryExhaustedException extends RuntimeException {

    private final String sinkName;
    private final int attempts;

    public DeliveryExhaustedException(String sinkName, int attempts, Throwable cause) {
        super(String.format("Sink %s gave up after %d attempts: %s",
                sinkName, attempts, cause == null ? "unknown" : cause.getMessage()), cause);
        this.sinkName = sinkName;
        this.attempts = attempts;
    }

    public String getSinkName() {
        return sinkName;
    }

    /** 첫 시도를 포함한 시도 횟수 */
    public int getAttempts() {
        return attempts;
    }
}
