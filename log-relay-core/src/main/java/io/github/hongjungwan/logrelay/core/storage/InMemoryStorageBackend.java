package io.github.hongjungwan.logrelay.core.storage;

import io.github.hongjungwan.logrelay.spi.StorageBackend;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 프로세스 로컬 메모리 저장소. 단일 인스턴스 배포와 테스트용.
 */
public class InMemoryStorageBackend implements StorageBackend {

    private final Map<String, String> items = new ConcurrentHashMap<>();

    @Override
    public String getItem(String key) {
        return items.get(key);
    }

    @Override
    public void setItem(String key, String value) {
        items.put(key, value);
    }

    @Override
    public void removeItem(String key) {
        items.remove(key);
    }

    @Override
    public Set<String> getKeys(String prefix) {
        return items.keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .collect(Collectors.toSet());
    }

    public int size() {
        return items.size();
    }
}
