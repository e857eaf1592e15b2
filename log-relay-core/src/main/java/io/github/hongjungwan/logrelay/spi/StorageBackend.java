package io.github.hongjungwan.logrelay.spi;

import java.util.Set;

/**
 * 원시 문자열 저장소. Redis, 파일, 메모리 등으로 구현. 실패 시 {@link StorageException}.
 */
public interface StorageBackend {

    String getItem(String key);

    void setItem(String key, String value);

    void removeItem(String key);

    /** prefix 로 시작하는 키 목록 */
    Set<String> getKeys(String prefix);
}
