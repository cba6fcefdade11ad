package com.aceflow.research.entity;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Classified reason for a failed documentation fetch.
 * The transient flag decides whether the fetcher schedules another attempt.
 */
public enum FetchFailureReason {
    // Timeouts
    TIMEOUT("timeout", "HTTP request timed out", true),

    // Connection/Network errors
    CONNECTION_RESET("connection_reset", "Connection reset or closed prematurely", true),
    CONNECTION_REFUSED("connection_refused", "Connection refused by remote host", true),
    DNS_RESOLUTION_FAILED("dns_resolution_failed", "DNS resolution failed", false),
    SSL_HANDSHAKE_FAILED("ssl_handshake_failed", "SSL handshake failed", false),

    // HTTP status errors
    HTTP_SERVER_ERROR("http_server_error", "Server returned 5xx", true),
    HTTP_RATE_LIMITED("http_rate_limited", "Server returned 429 Too Many Requests", true),
    HTTP_CLIENT_ERROR("http_client_error", "Server returned 4xx", false),

    // Request/content errors
    INVALID_URL("invalid_url", "Invalid URL provided", false),
    EMPTY_CONTENT("empty_content", "Response had no body", false),

    // Run management
    CANCELLED("cancelled", "Fetch aborted because the run was cancelled", false),
    RUN_DEADLINE("run_deadline", "Fetch aborted because the run timeout was exceeded", false),

    UNKNOWN("unknown", "Unknown error occurred", false);

    private final String code;
    private final String description;
    private final boolean transientFailure;

    FetchFailureReason(String code, String description, boolean transientFailure) {
        this.code = code;
        this.description = description;
        this.transientFailure = transientFailure;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    /**
     * Maps an HTTP status to a failure reason. 429 counts as transient like 5xx.
     */
    public static FetchFailureReason fromStatus(int status) {
        if (status == 429) return HTTP_RATE_LIMITED;
        if (status >= 500) return HTTP_SERVER_ERROR;
        if (status >= 400) return HTTP_CLIENT_ERROR;
        return UNKNOWN;
    }

    /**
     * Get failure reason from an exception raised by the WebClient pipeline.
     */
    public static FetchFailureReason fromException(Throwable e) {
        if (e == null) return UNKNOWN;

        if (e instanceof FetchFailureCarrier carrier) {
            return carrier.getReason();
        }
        if (e instanceof WebClientResponseException wce) {
            return fromStatus(wce.getStatusCode().value());
        }
        if (e instanceof TimeoutException) {
            return TIMEOUT;
        }
        if (e instanceof InterruptedException || e instanceof CancellationException) {
            return CANCELLED;
        }
        if (e instanceof IllegalArgumentException) {
            return INVALID_URL;
        }
        if (e instanceof WebClientRequestException wre && wre.getCause() != null) {
            return fromException(wre.getCause());
        }
        if (e instanceof UnknownHostException) {
            return DNS_RESOLUTION_FAILED;
        }
        if (e instanceof SSLException) {
            return SSL_HANDSHAKE_FAILED;
        }
        if (e instanceof ConnectException) {
            return CONNECTION_REFUSED;
        }

        String message = e.getMessage() != null ? e.getMessage().toLowerCase(Locale.ROOT) : "";
        String className = e.getClass().getSimpleName().toLowerCase(Locale.ROOT);

        if (className.contains("timeout") || message.contains("timed out")) {
            return TIMEOUT;
        }
        if (message.contains("connection reset") || message.contains("prematurely closed")
                || className.contains("prematureclose")) {
            return CONNECTION_RESET;
        }
        if (e instanceof IOException) {
            return CONNECTION_RESET;
        }
        if (e.getCause() != null && e.getCause() != e) {
            return fromException(e.getCause());
        }
        return UNKNOWN;
    }

    /**
     * Implemented by exceptions that already know their classification.
     */
    public interface FetchFailureCarrier {
        FetchFailureReason getReason();
    }

    @Override
    public String toString() {
        return code;
    }
}
