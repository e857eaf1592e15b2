package io.github.hongjungwan.logrelay.spi;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * TTL 을 지원하는 키-값 저장소 계약. 실패 시 {@link StorageException}.
 */
public interface KeyValueStore {

    /** 값 조회. 없거나 만료되었으면 null */
    <T> T get(String key, Class<T> type);

    /** 제네릭 타입 값 조회. 없거나 만료되었으면 null */
    <T> T get(String key, TypeReference<T> type);

    /** TTL 없이 저장 */
    void set(String key, Object value);

    /** TTL (seconds) 과 함께 저장. ttlSeconds 가 0 이하면 TTL 없음 */
    void set(String key, Object value, long ttlSeconds);

    void delete(String key);

    /** 현재 값 + 1 을 저장하고 반환. 없으면 1 */
    long increment(String key, long ttlSeconds);

    /**
     * 만료된 키 정리. 자체 만료를 지원하는 저장소는 구현하지 않아도 된다.
     *
     * @return 삭제된 키 수
     */
    default int cleanup(int chunkSize) {
        return 0;
    }
}
