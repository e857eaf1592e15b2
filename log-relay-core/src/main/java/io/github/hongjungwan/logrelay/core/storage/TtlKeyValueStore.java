package io.github.hongjungwan.logrelay.core.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hongjungwan.logrelay.spi.KeyValueStore;
import io.github.hongjungwan.logrelay.spi.StorageBackend;
import io.github.hongjungwan.logrelay.spi.StorageException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * StorageBackend 위의 namespace + TTL 계층.
 *
 * <p>TTL 이 있는 값은 {@code {"data": ..., "expiresAt": epochMillis}} 로 감싸 저장하고,
 * 조회 시 만료되었으면 삭제 후 null 을 반환한다. 키는 {@code {namespace}:{key}} 형태로 저장된다.</p>
 */
@Slf4j
public class TtlKeyValueStore implements KeyValueStore {

    private static final String DATA = "data";
    private static final String EXPIRES_AT = "expiresAt";

    private final StorageBackend backend;
    private final String prefix;
    private final ObjectMapper objectMapper;
    private final LongSupplier clock;

    public TtlKeyValueStore(StorageBackend backend, String namespace, ObjectMapper objectMapper, LongSupplier clock) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        this.backend = backend;
        this.prefix = namespace + ":";
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public <T> T get(String key, Class<T> type) {
        JsonNode node = read(key);
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StorageException("Failed to decode value for key: " + key, e);
        }
    }

    @Override
    public <T> T get(String key, TypeReference<T> type) {
        JsonNode node = read(key);
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.convertValue(node, type);
        } catch (IllegalArgumentException e) {
            throw new StorageException("Failed to decode value for key: " + key, e);
        }
    }

    @Override
    public void set(String key, Object value) {
        set(key, value, 0);
    }

    @Override
    public void set(String key, Object value, long ttlSeconds) {
        Object stored = ttlSeconds > 0
                ? new TtlEnvelope(value, clock.getAsLong() + ttlSeconds * 1000)
                : value;
        String json;
        try {
            json = objectMapper.writeValueAsString(stored);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to encode value for key: " + key, e);
        }
        execute(() -> backend.setItem(prefix + key, json), "set", key);
    }

    @Override
    public void delete(String key) {
        execute(() -> backend.removeItem(prefix + key), "delete", key);
    }

    @Override
    public long increment(String key, long ttlSeconds) {
        Long current = get(key, Long.class);
        long next = (current == null ? 0 : current) + 1;
        set(key, next, ttlSeconds);
        return next;
    }

    /**
     * 만료된 키를 chunkSize 단위로 삭제. 개별 키 실패는 건너뛴다.
     *
     * @return 삭제된 키 수
     */
    @Override
    public int cleanup(int chunkSize) {
        List<String> keys;
        try {
            keys = new ArrayList<>(backend.getKeys(prefix));
        } catch (RuntimeException e) {
            log.warn("Storage cleanup skipped, key listing failed: {}", e.getMessage());
            return 0;
        }

        int size = Math.max(1, chunkSize);
        int removed = 0;
        int failed = 0;
        long now = clock.getAsLong();

        for (int from = 0; from < keys.size(); from += size) {
            for (String fullKey : keys.subList(from, Math.min(keys.size(), from + size))) {
                try {
                    String raw = backend.getItem(fullKey);
                    if (raw != null && isExpiredOrMalformed(raw, now)) {
                        backend.removeItem(fullKey);
                        removed++;
                    }
                } catch (RuntimeException e) {
                    failed++;
                    log.debug("Cleanup failed for key {}: {}", fullKey, e.getMessage());
                }
            }
        }

        if (removed > 0 || failed > 0) {
            log.debug("Storage cleanup removed {} expired keys ({} failures) under {}", removed, failed, prefix);
        }
        return removed;
    }

    public String getNamespacePrefix() {
        return prefix;
    }

    private JsonNode read(String key) {
        String fullKey = prefix + key;
        String raw = call(() -> backend.getItem(fullKey), "get", key);
        if (raw == null) {
            return null;
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.warn("Discarding malformed value for key {}: {}", key, e.getOriginalMessage());
            execute(() -> backend.removeItem(fullKey), "delete", key);
            return null;
        }

        if (isEnvelope(node)) {
            if (isExpired(node, clock.getAsLong())) {
                execute(() -> backend.removeItem(fullKey), "delete", key);
                return null;
            }
            return node.get(DATA);
        }
        return node;
    }

    private static boolean isEnvelope(JsonNode node) {
        return node != null && node.isObject() && node.size() == 2
                && node.has(DATA) && node.has(EXPIRES_AT) && node.get(EXPIRES_AT).isNumber();
    }

    private static boolean isExpired(JsonNode node, long now) {
        return isEnvelope(node) && now > node.get(EXPIRES_AT).asLong();
    }

    private boolean isExpiredOrMalformed(String raw, long now) {
        try {
            return isExpired(objectMapper.readTree(raw), now);
        } catch (JsonProcessingException e) {
            return true;
        }
    }

    private void execute(Runnable operation, String name, String key) {
        call(() -> {
            operation.run();
            return null;
        }, name, key);
    }

    private <T> T call(Supplier<T> operation, String name, String key) {
        try {
            return operation.get();
        } catch (StorageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StorageException("Storage " + name + " failed for key: " + key, e);
        }
    }

    /** TTL 값 저장 형식 */
    record TtlEnvelope(Object data, long expiresAt) {
    }
}
