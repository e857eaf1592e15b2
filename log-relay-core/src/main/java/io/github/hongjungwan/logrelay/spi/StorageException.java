package io.github.hongjungwan.logrelay.spi;

/**
 * 저장소 연산 실패.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
