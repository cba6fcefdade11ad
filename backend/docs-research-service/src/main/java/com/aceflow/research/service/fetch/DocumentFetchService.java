package com.aceflow.research.service.fetch;

import com.aceflow.research.config.ResearchProperties;
import com.aceflow.research.dto.CachedContent;
import com.aceflow.research.dto.FetchResult;
import com.aceflow.research.dto.FetchTarget;
import com.aceflow.research.entity.FetchFailureReason;
import com.aceflow.research.exception.FetchFailureException;
import com.aceflow.research.service.RunCancellation;
import com.aceflow.research.util.UrlUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Document Fetch Service
 *
 * 대상 URL을 bounded worker pool에서 병렬로 가져옵니다.
 * - 호스트별 동시 요청 제한 (HostConcurrencyLimiter)
 * - 일시적 실패(timeout, 5xx, 429, connection reset)는 exponential backoff + jitter로 재시도
 * - 캐시 hit이면 네트워크 요청 없이 캐시 내용을 반환
 *
 * 개별 실패는 예외로 전파되지 않고 FetchResult(status=error|timeout)로 기록됩니다.
 * 결과는 입력 대상과 같은 순서로 정확히 하나씩 반환됩니다.
 */
@Service
@Slf4j
public class DocumentFetchService {

    private static final long POLL_INTERVAL_MS = 100;

    private final WebClient webClient;
    private final ThreadPoolTaskExecutor fetchExecutor;
    private final ContentCacheService cacheService;
    private final HostConcurrencyLimiter hostLimiter;
    private final ResearchProperties.Fetch settings;
    private final BackoffPolicy backoff;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public DocumentFetchService(WebClient documentWebClient,
                                @Qualifier("fetchExecutor") ThreadPoolTaskExecutor fetchExecutor,
                                ContentCacheService cacheService,
                                HostConcurrencyLimiter hostLimiter,
                                ResearchProperties properties,
                                MeterRegistry meterRegistry,
                                Clock clock) {
        this.webClient = documentWebClient;
        this.fetchExecutor = fetchExecutor;
        this.cacheService = cacheService;
        this.hostLimiter = hostLimiter;
        this.settings = properties.getFetch();
        this.backoff = BackoffPolicy.from(settings);
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Fetches every target and returns one result per target, in input order.
     *
     * When the run is cancelled or its deadline passes, queued and in-flight fetches are
     * aborted and reported with status timeout; results already obtained are kept.
     */
    public List<FetchResult> fetchAll(List<FetchTarget> targets, RunCancellation cancellation, boolean bypassCache) {
        if (targets.isEmpty()) {
            return List.of();
        }
        log.info("Fetching {} targets (concurrency={}, perHostLimit={}, bypassCache={})",
                targets.size(), settings.getConcurrency(), settings.getPerHostLimit(), bypassCache);

        Map<FetchTarget, AtomicInteger> attempts = new LinkedHashMap<>();
        Map<FetchTarget, Future<FetchResult>> futures = new LinkedHashMap<>();
        for (FetchTarget target : targets) {
            AtomicInteger counter = new AtomicInteger();
            attempts.put(target, counter);
            futures.put(target, fetchExecutor.submit(() -> fetchOne(target, cancellation, bypassCache, counter)));
        }

        List<FetchResult> results = new ArrayList<>(targets.size());
        for (Map.Entry<FetchTarget, Future<FetchResult>> entry : futures.entrySet()) {
            results.add(await(entry.getKey(), entry.getValue(), cancellation, attempts.get(entry.getKey())));
        }

        long ok = results.stream().filter(FetchResult::isOk).count();
        log.info("Fetch complete: {} ok, {} failed of {}", ok, results.size() - ok, results.size());
        return results;
    }

    /**
     * Fetches a single target on the calling thread. Never throws.
     */
    public FetchResult fetchOne(FetchTarget target, RunCancellation cancellation, boolean bypassCache,
                                AtomicInteger attempts) {
        if (cancellation.isCancelled()) {
            return record(FetchResult.aborted(target, cancellation.reason(), now(), attempts.get()));
        }
        if (!UrlUtils.isHttpUrl(target.url())) {
            FetchFailureException invalid = FetchFailureException.invalidUrl(target.url());
            return record(FetchResult.failed(target, invalid.getReason(), invalid.getMessage(), now(), 0));
        }

        if (!bypassCache) {
            Optional<CachedContent> cached = cacheService.get(target.url());
            if (cached.isPresent()) {
                cacheCounter("hit");
                return record(FetchResult.cached(target, cached.get()));
            }
            cacheCounter("miss");
        }

        String host = target.host();
        try {
            hostLimiter.acquire(host);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return record(FetchResult.aborted(target, abortReason(cancellation), now(), attempts.get()));
        }

        try {
            ResponseEntity<String> response = request(target, attempts).block();
            String body = response == null ? null : response.getBody();
            if (body == null || body.isBlank()) {
                throw FetchFailureException.emptyContent(target.url());
            }
            String contentType = contentTypeOf(response);
            Instant fetchedAt = now();
            cacheService.put(target.url(), body, contentType, fetchedAt);
            log.debug("Fetched {} ({} chars, attempts={})", target.url(), body.length(), attempts.get());
            return record(FetchResult.ok(target, body, contentType, fetchedAt, attempts.get()));
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (Thread.currentThread().isInterrupted() || cancellation.isCancelled()) {
                return record(FetchResult.aborted(target, abortReason(cancellation), now(), attempts.get()));
            }
            FetchFailureReason reason = FetchFailureReason.fromException(cause);
            log.warn("Fetch failed: url={}, reason={}, attempts={}, error={}",
                    target.url(), reason.getCode(), attempts.get(), cause.getMessage());
            return record(FetchResult.failed(target, reason, describe(cause), now(), attempts.get()));
        } finally {
            hostLimiter.release(host);
        }
    }

    private Mono<ResponseEntity<String>> request(FetchTarget target, AtomicInteger attempts) {
        return Mono.defer(() -> {
                    attempts.incrementAndGet();
                    return webClient.get()
                            .uri(URI.create(target.url()))
                            .retrieve()
                            .toEntity(String.class);
                })
                .timeout(settings.getTimeout())
                .retryWhen(retrySpec(target));
    }

    /**
     * Retries transient failures only, up to maxRetries after the first attempt.
     * The last failure is propagated once retries are exhausted.
     */
    private Retry retrySpec(FetchTarget target) {
        int maxRetries = settings.getMaxRetries();
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            long retry = signal.totalRetries();
            FetchFailureReason reason = FetchFailureReason.fromException(failure);
            if (!reason.isTransient() || retry >= maxRetries) {
                return Mono.error(failure);
            }
            Duration delay = backoff.delayFor(retry);
            log.info("Retrying {} after {} (retry {}/{}, delay={}ms)",
                    target.url(), reason.getCode(), retry + 1, maxRetries, delay.toMillis());
            return Mono.delay(delay).thenReturn(retry);
        }));
    }

    private FetchResult await(FetchTarget target, Future<FetchResult> future, RunCancellation cancellation,
                              AtomicInteger attempts) {
        while (true) {
            try {
                return future.get(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (cancellation.isCancelled()) {
                    future.cancel(true);
                    log.warn("Aborted fetch of {} ({})", target.url(), cancellation.reason().getCode());
                    return record(FetchResult.aborted(target, cancellation.reason(), now(), attempts.get()));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancellation.cancel();
                future.cancel(true);
                return record(FetchResult.aborted(target, FetchFailureReason.CANCELLED, now(), attempts.get()));
            } catch (ExecutionException e) {
                // fetchOne catches everything it can classify
                log.error("Unexpected fetch worker failure for {}: {}", target.url(), e.getCause().getMessage(), e.getCause());
                return record(FetchResult.failed(target, FetchFailureReason.UNKNOWN,
                        String.valueOf(e.getCause().getMessage()), now(), attempts.get()));
            }
        }
    }

    private FetchFailureReason abortReason(RunCancellation cancellation) {
        FetchFailureReason reason = cancellation.reason();
        return reason != null ? reason : FetchFailureReason.CANCELLED;
    }

    private static String contentTypeOf(ResponseEntity<String> response) {
        MediaType mediaType = response.getHeaders().getContentType();
        return mediaType == null ? null : mediaType.toString();
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private FetchResult record(FetchResult result) {
        Counter.builder("research.fetch.results")
                .description("Fetch results by status")
                .tag("status", result.status().getCode())
                .register(meterRegistry)
                .increment();
        return result;
    }

    private void cacheCounter(String outcome) {
        Counter.builder("research.fetch.cache")
                .tag("result", outcome)
                .register(meterRegistry)
                .increment();
    }
}
