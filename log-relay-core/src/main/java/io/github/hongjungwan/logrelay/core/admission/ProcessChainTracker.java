package io.github.hongjungwan.logrelay.core.admission;

import io.github.hongjungwan.logrelay.api.domain.BatchMeta;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 수집한 배치의 process chain 을 기억했다가 HTTP 전달 시 이어 붙인다.
 *
 * <p>relay A 가 B 로 전달한 배치가 다시 A 로 돌아오면 A 의 다음 전달 chain 에 A 가 두 번 들어가고,
 * 받는 쪽의 {@link LoopDetector} 가 중복 reporter 로 루프를 잡는다.
 * 최근 본 reporter ID 만 최대 maxIds 개까지 유지한다.</p>
 */
public class ProcessChainTracker {

    static final int DEFAULT_MAX_IDS = 32;

    private final int maxIds;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashSet<String> upstream = new LinkedHashSet<>();

    public ProcessChainTracker() {
        this(DEFAULT_MAX_IDS);
    }

    public ProcessChainTracker(int maxIds) {
        if (maxIds <= 0) {
            throw new IllegalArgumentException("maxIds must be positive: " + maxIds);
        }
        this.maxIds = maxIds;
    }

    /**
     * 처리된 배치의 chain 을 기록. 처리 표시가 없거나 chain 이 비어 있으면 무시한다.
     */
    public void record(BatchMeta meta) {
        if (meta == null || !meta.processed() || meta.processChain().isEmpty()) {
            return;
        }
        lock.lock();
        try {
            for (String id : meta.processChain()) {
                // 최근 본 ID 를 뒤로
                upstream.remove(id);
                upstream.add(id);
            }
            Iterator<String> oldest = upstream.iterator();
            while (upstream.size() > maxIds) {
                oldest.next();
                oldest.remove();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 전달용 chain. 기록된 upstream 뒤에 selfId 를 붙인다 (중복 제거하지 않음).
     */
    public List<String> outboundChain(String selfId) {
        lock.lock();
        try {
            List<String> chain = new ArrayList<>(upstream.size() + 1);
            chain.addAll(upstream);
            chain.add(selfId);
            return chain;
        } finally {
            lock.unlock();
        }
    }

    public List<String> getUpstream() {
        lock.lock();
        try {
            return List.copyOf(upstream);
        } finally {
            lock.unlock();
        }
    }
}
