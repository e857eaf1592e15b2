package io.github.hongjungwan.logrelay.core.diagnostics;

import io.github.hongjungwan.logrelay.api.config.LogRelayConfig;
import io.github.hongjungwan.logrelay.spi.KeyValueStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Doctor Service - relay 자가 진단
 *
 * 시작 시 (SmartLifecycle.start) 다음을 확인한다:
 * 1. 로그 파일 디렉토리 쓰기 권한
 * 2. KeyValueStore 쓰기/읽기/삭제
 * 3. HTTP 전달 엔드포인트 형식
 *
 * 실패는 경고로 기록만 하고 시작을 막지 않는다.
 */
@Slf4j
public class LogRelayDoctor {

    static final String CHECK_KEY = "doctor:check";

    private final LogRelayConfig config;
    private final KeyValueStore store;

    public LogRelayDoctor(LogRelayConfig config, KeyValueStore store) {
        this.config = config;
        this.store = store;
    }

    /**
     * 모든 진단 실행
     */
    public DiagnosticReport diagnose() {
        log.info("Running log-relay diagnostic checks...");

        List<DiagnosticResult> results = new ArrayList<>();
        results.add(checkFileDirectory());
        results.add(checkStorage());
        results.add(checkHttpEndpoint());

        DiagnosticReport report = new DiagnosticReport(results);
        if (report.hasFailures()) {
            log.warn("Diagnostic failures detected:");
            report.getFailedChecks().forEach(result ->
                    log.warn("  - {}: {}", result.getName(), result.getMessage())
            );
        } else {
            log.info("All diagnostic checks passed");
        }
        return report;
    }

    /**
     * Check 1: 로그 디렉토리 쓰기
     */
    private DiagnosticResult checkFileDirectory() {
        if (!config.isFileEnabled()) {
            return DiagnosticResult.warning("File Directory", "File sink disabled");
        }
        try {
            Path directory = Paths.get(config.getFile().getDirectory());
            Files.createDirectories(directory);

            Path checkFile = directory.resolve(".log-relay-write-check");
            Files.writeString(checkFile, "check");
            String content = Files.readString(checkFile);
            Files.deleteIfExists(checkFile);

            if ("check".equals(content)) {
                return DiagnosticResult.success("File Directory", "Log directory writable: " + directory);
            }
            return DiagnosticResult.failure("File Directory", "Write verification failed");

        } catch (IOException | RuntimeException e) {
            return DiagnosticResult.failure("File Directory",
                    "Cannot write to log directory: " + e.getMessage());
        }
    }

    /**
     * Check 2: 저장소 round-trip
     */
    private DiagnosticResult checkStorage() {
        try {
            long marker = System.nanoTime();
            store.set(CHECK_KEY, marker, 60);
            Long read = store.get(CHECK_KEY, Long.class);
            store.delete(CHECK_KEY);

            if (read != null && read == marker) {
                return DiagnosticResult.success("Storage", "Key-value store round-trip succeeded");
            }
            return DiagnosticResult.failure("Storage", "Read back " + read + ", expected " + marker);

        } catch (RuntimeException e) {
            return DiagnosticResult.failure("Storage", "Key-value store unavailable: " + e.getMessage());
        }
    }

    /**
     * Check 3: HTTP 엔드포인트 형식 (연결은 시도하지 않음)
     */
    private DiagnosticResult checkHttpEndpoint() {
        if (config.getHttp() == null) {
            return DiagnosticResult.warning("HTTP Endpoint", "HTTP forwarding not configured");
        }
        String endpoint = config.getHttp().getEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            return DiagnosticResult.failure("HTTP Endpoint", "Endpoint is empty");
        }
        try {
            URI uri = URI.create(endpoint.trim());
            String scheme = uri.getScheme();
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                return DiagnosticResult.failure("HTTP Endpoint", "Endpoint must be http(s): " + endpoint);
            }
            if (uri.getHost() == null) {
                return DiagnosticResult.failure("HTTP Endpoint", "Endpoint has no host: " + endpoint);
            }
            return DiagnosticResult.success("HTTP Endpoint", "Forwarding to " + uri);
        } catch (IllegalArgumentException e) {
            return DiagnosticResult.failure("HTTP Endpoint", "Malformed endpoint: " + e.getMessage());
        }
    }

    /**
     * Diagnostic result
     */
    public static class DiagnosticResult {
        private final String name;
        private final Status status;
        private final String message;

        public enum Status {
            SUCCESS, WARNING, FAILURE
        }

        private DiagnosticResult(String name, Status status, String message) {
            this.name = name;
            this.status = status;
            this.message = message;
        }

        public static DiagnosticResult success(String name, String message) {
            return new DiagnosticResult(name, Status.SUCCESS, message);
        }

        public static DiagnosticResult warning(String name, String message) {
            return new DiagnosticResult(name, Status.WARNING, message);
        }

        public static DiagnosticResult failure(String name, String message) {
            return new DiagnosticResult(name, Status.FAILURE, message);
        }

        public String getName() {
            return name;
        }

        public Status getStatus() {
            return status;
        }

        public String getMessage() {
            return message;
        }

        public boolean isFailure() {
            return status == Status.FAILURE;
        }
    }

    /**
     * Diagnostic report
     */
    public static class DiagnosticReport {
        private final List<DiagnosticResult> results;

        public DiagnosticReport(List<DiagnosticResult> results) {
            this.results = List.copyOf(results);
        }

        public boolean hasFailures() {
            return results.stream().anyMatch(DiagnosticResult::isFailure);
        }

        public List<DiagnosticResult> getFailedChecks() {
            return results.stream()
                    .filter(DiagnosticResult::isFailure)
                    .toList();
        }

        public List<DiagnosticResult> getAllResults() {
            return results;
        }

        public DiagnosticResult get(String name) {
            return results.stream()
                    .filter(result -> result.getName().equals(name))
                    .findFirst()
                    .orElse(null);
        }
    }
}
