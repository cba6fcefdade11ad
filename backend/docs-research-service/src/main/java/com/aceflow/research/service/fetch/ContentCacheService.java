package com.aceflow.research.service.fetch;

import com.aceflow.research.config.ResearchProperties;
import com.aceflow.research.dto.CachedContent;
import com.aceflow.research.util.HashUtils;
import com.aceflow.research.util.UrlUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Fetched Content Cache Service
 *
 * 2단계 캐시로 문서 본문을 URL 단위로 캐싱합니다.
 * - 메모리: Caffeine (maxEntries)
 * - 디스크: cache.directory 아래 URL SHA-256 이름의 JSON 파일, 실행 간 재사용
 * - TTL: cache.ttl (기본 24시간), 기록 시각 기준
 *
 * 엔트리는 불변이며 같은 URL을 동시에 기록해도 마지막 기록이 원자적으로 남습니다.
 */
@Service
@Slf4j
public class ContentCacheService {

    private final ResearchProperties.Cache settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Cache<String, CachedContent> memory;

    public ContentCacheService(ResearchProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.settings = properties.getCache();
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.memory = Caffeine.newBuilder()
                .maximumSize(settings.getMaxEntries())
                .expireAfterWrite(settings.getTtl())
                .build();
    }

    /**
     * Fresh entry for the URL, if any.
     */
    public Optional<CachedContent> get(String url) {
        if (!settings.isEnabled()) {
            return Optional.empty();
        }
        String key = keyOf(url);

        CachedContent cached = memory.getIfPresent(key);
        if (cached == null) {
            cached = readFile(key).orElse(null);
            if (cached != null) {
                memory.put(key, cached);
            }
        }

        if (cached == null) {
            log.debug("Cache MISS: {}", url);
            return Optional.empty();
        }
        if (isExpired(cached)) {
            log.debug("Cache EXPIRED: url={}, cachedAt={}", url, cached.cachedAt());
            memory.invalidate(key);
            return Optional.empty();
        }
        log.debug("Cache HIT: url={}, cachedAt={}", url, cached.cachedAt());
        return Optional.of(cached);
    }

    /**
     * Stores fetched content. Failures are logged and otherwise ignored: the fetch result stands.
     */
    public CachedContent put(String url, String content, String contentType, Instant fetchedAt) {
        CachedContent entry = new CachedContent(url, content, contentType, fetchedAt);
        if (!settings.isEnabled()) {
            return entry;
        }
        String key = keyOf(url);
        memory.put(key, entry);
        writeFile(key, entry);
        return entry;
    }

    public void invalidateMemory() {
        memory.invalidateAll();
    }

    private boolean isExpired(CachedContent cached) {
        Duration ttl = settings.getTtl();
        return cached.cachedAt() == null || !clock.instant().isBefore(cached.cachedAt().plus(ttl));
    }

    private Optional<CachedContent> readFile(String key) {
        Path file = fileOf(key);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), CachedContent.class));
        } catch (IOException e) {
            log.warn("Error reading cache file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeFile(String key, CachedContent entry) {
        Path file = fileOf(key);
        try {
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), key, ".tmp");
            objectMapper.writeValue(tmp.toFile(), entry);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Cached content: url={}, bytes={}", entry.url(),
                    entry.content() == null ? 0 : entry.content().length());
        } catch (IOException e) {
            log.warn("Error writing cache file {}: {}", file, e.getMessage());
        }
    }

    private Path fileOf(String key) {
        return settings.getDirectory().resolve(key.substring(0, 2)).resolve(key + ".json");
    }

    private static String keyOf(String url) {
        return HashUtils.sha256Hex(UrlUtils.normalize(url));
    }
}
