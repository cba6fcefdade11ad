package com.aceflow.research.service.fetch;

import com.aceflow.research.config.ResearchProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * 호스트별 동시 요청 제한 (polite crawling).
 * 호스트마다 perHostLimit 크기의 fair semaphore를 둡니다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HostConcurrencyLimiter {

    private final ResearchProperties properties;

    private final Map<String, Semaphore> hostPermits = new ConcurrentHashMap<>();

    /**
     * Blocks until a permit for the host is available.
     *
     * @throws InterruptedException when the worker is interrupted while waiting (run cancelled)
     */
    public void acquire(String host) throws InterruptedException {
        Semaphore semaphore = permitsFor(host);
        if (!semaphore.tryAcquire()) {
            log.debug("Waiting for host permit: host={}, available={}", host, semaphore.availablePermits());
            semaphore.acquire();
        }
    }

    public void release(String host) {
        permitsFor(host).release();
    }

    public int availablePermits(String host) {
        return permitsFor(host).availablePermits();
    }

    private Semaphore permitsFor(String host) {
        String key = host == null || host.isBlank() ? "unknown" : host;
        return hostPermits.computeIfAbsent(key, k -> new Semaphore(properties.getFetch().getPerHostLimit(), true));
    }
}
