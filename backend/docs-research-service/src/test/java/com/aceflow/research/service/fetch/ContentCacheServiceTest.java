package com.aceflow.research.service.fetch;

import com.aceflow.research.config.ResearchProperties;
import com.aceflow.research.dto.CachedContent;
import com.aceflow.research.support.MutableClock;
import com.aceflow.research.support.ResearchFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ContentCacheService 단위 테스트 (메모리 + 파일 2단계 캐시)
 */
class ContentCacheServiceTest {

    private static final String URL = "https://docs.example.com/data";

    @TempDir
    Path tempDir;

    private ResearchProperties properties;
    private MutableClock clock;
    private ContentCacheService cache;

    @BeforeEach
    void setUp() {
        properties = ResearchFixtures.properties(tempDir);
        clock = new MutableClock(ResearchFixtures.FETCHED_AT);
        cache = new ContentCacheService(properties, ResearchFixtures.objectMapper(), clock);
    }

    @Test
    @DisplayName("저장한 내용은 TTL 안에서 조회된다")
    void hitWithinTtl() {
        // given
        cache.put(URL, "<html>data</html>", "text/html", clock.instant());
        clock.advance(Duration.ofHours(23));

        // when
        Optional<CachedContent> cached = cache.get(URL);

        // then
        assertThat(cached).isPresent();
        assertThat(cached.get().content()).isEqualTo("<html>data</html>");
        assertThat(cached.get().cachedAt()).isEqualTo(ResearchFixtures.FETCHED_AT);
    }

    @Test
    @DisplayName("TTL이 지나면 miss")
    void expiredAfterTtl() {
        cache.put(URL, "<html>data</html>", "text/html", clock.instant());
        clock.advance(Duration.ofHours(24));

        assertThat(cache.get(URL)).isEmpty();
    }

    @Test
    @DisplayName("메모리 캐시가 비어도 파일 캐시에서 다시 읽는다 (실행 간 재사용)")
    void survivesAcrossInstances() {
        // given
        cache.put(URL, "<html>data</html>", "text/html", clock.instant());
        ContentCacheService nextRun = new ContentCacheService(properties, ResearchFixtures.objectMapper(), clock);

        // when
        Optional<CachedContent> cached = nextRun.get(URL + "#section");

        // then
        assertThat(cached).isPresent();
        assertThat(cached.get().contentType()).isEqualTo("text/html");
    }

    @Test
    @DisplayName("같은 URL에 다시 쓰면 마지막 값이 남고 임시 파일은 남지 않는다")
    void overwriteIsAtomic() throws Exception {
        cache.put(URL, "first", "text/html", clock.instant());
        cache.put(URL, "second", "text/html", clock.instant());
        cache.invalidateMemory();

        assertThat(cache.get(URL)).map(CachedContent::content).contains("second");
        try (Stream<Path> files = Files.walk(properties.getCache().getDirectory())) {
            assertThat(files.filter(Files::isRegularFile))
                    .allMatch(p -> p.getFileName().toString().endsWith(".json"));
        }
    }

    @Test
    @DisplayName("캐시가 비활성화되면 항상 miss")
    void disabledCache() {
        properties.getCache().setEnabled(false);
        ContentCacheService disabled = new ContentCacheService(properties, ResearchFixtures.objectMapper(), clock);

        disabled.put(URL, "content", "text/html", clock.instant());

        assertThat(disabled.get(URL)).isEmpty();
    }
}
