package com.aceflow.research.config;

import com.aceflow.research.dto.FetchTarget;
import com.aceflow.research.dto.ResearchOutcome;
import com.aceflow.research.dto.ResearchRequest;
import com.aceflow.research.exception.FatalConfigException;
import com.aceflow.research.exception.ResearchPipelineException;
import com.aceflow.research.service.ResearchPipelineService;
import com.aceflow.research.service.RunCancellation;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Command line entry point of the research pipeline.
 *
 * Usage:
 * <pre>
 *   --domain=&lt;text&gt; --pattern=&lt;name&gt; [--output=&lt;dir&gt;] [--refresh] [--dry-run]
 * </pre>
 *
 * Exit status: 0 complete, 1 incomplete (bundle still written), 2 fatal.
 * Disable with research.runner.enabled=false (tests).
 */
@Component
@ConditionalOnProperty(
    name = "research.runner.enabled",
    havingValue = "true",
    matchIfMissing = true
)
@RequiredArgsConstructor
@Slf4j
public class ResearchCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String OPT_DOMAIN = "domain";
    static final String OPT_PATTERN = "pattern";
    static final String OPT_OUTPUT = "output";
    static final String OPT_REFRESH = "refresh";
    static final String OPT_DRY_RUN = "dry-run";

    private final ResearchPipelineService pipelineService;
    private final ResearchProperties properties;
    private final Clock clock;

    private final AtomicReference<ActiveRun> activeRun = new AtomicReference<>();

    private volatile int exitCode = ResearchOutcome.EXIT_COMPLETE;

    @Override
    public void run(ApplicationArguments args) {
        ActiveRun current = null;
        try {
            ResearchRequest request = toRequest(args);

            if (args.containsOption(OPT_DRY_RUN)) {
                List<FetchTarget> targets = pipelineService.plan(request);
                targets.forEach(t -> log.info("[dry-run] {} {} {} {}",
                        t.priority().getCode(), t.category().getCode(), t.topic(), t.url()));
                log.info("[dry-run] {} targets resolved for {}", targets.size(), request.describe());
                exitCode = ResearchOutcome.EXIT_COMPLETE;
                return;
            }

            current = new ActiveRun(RunCancellation.withTimeout(properties.getRun().getTimeout(), clock),
                    new CountDownLatch(1));
            activeRun.set(current);
            ResearchOutcome outcome = pipelineService.run(request, current.cancellation());
            exitCode = outcome.exitCode();

            log.info("Research bundle {} at {} (overallScore={})",
                    outcome.bundle().status().getCode(), outcome.outputPath(), outcome.bundle().overallScore());
            if (!outcome.bundle().coverage().missingAreas().isEmpty()) {
                log.info("Missing areas: {}", outcome.bundle().coverage().missingAreas());
            }
        } catch (FatalConfigException e) {
            log.error("Fatal configuration error: {}", e.getMessage());
            exitCode = ResearchOutcome.EXIT_FATAL;
        } catch (ResearchPipelineException e) {
            log.error("Research run failed [{}]: {}", e.getErrorCode(), e.getMessage(), e);
            exitCode = ResearchOutcome.EXIT_FATAL;
        } catch (RuntimeException e) {
            log.error("Research run failed unexpectedly: {}", e.getMessage(), e);
            exitCode = ResearchOutcome.EXIT_FATAL;
        } finally {
            if (current != null) {
                activeRun.compareAndSet(current, null);
                current.finished().countDown();
            }
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Context shutdown (e.g. Ctrl+C) cancels the active run and waits, up to
     * research.run.shutdown-grace, for its bundle to be written.
     */
    @PreDestroy
    public void cancelActiveRun() {
        ActiveRun current = activeRun.get();
        if (current == null) {
            return;
        }
        log.warn("Shutdown requested, cancelling active research run");
        current.cancellation().cancel();

        Duration grace = properties.getRun().getShutdownGrace();
        try {
            if (!current.finished().await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Research run did not finish within {}, shutting down anyway", grace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the research run to finish");
        }
    }

    ResearchRequest toRequest(ApplicationArguments args) {
        String domain = singleValue(args, OPT_DOMAIN);
        String pattern = singleValue(args, OPT_PATTERN);
        if (domain == null) {
            throw FatalConfigException.missingArgument(OPT_DOMAIN);
        }
        if (pattern == null || pattern.isBlank()) {
            throw FatalConfigException.missingArgument(OPT_PATTERN);
        }

        ResearchRequest request = ResearchRequest.of(domain, pattern)
                .withBypassCache(args.containsOption(OPT_REFRESH));
        String output = singleValue(args, OPT_OUTPUT);
        if (output != null && !output.isBlank()) {
            request = request.withOutputDirectory(Path.of(output));
        }
        return request;
    }

    private record ActiveRun(RunCancellation cancellation, CountDownLatch finished) {
    }

    private static String singleValue(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return null;
        }
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
