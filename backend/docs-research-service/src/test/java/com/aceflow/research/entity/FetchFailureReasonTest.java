package com.aceflow.research.entity;

import com.aceflow.research.exception.FetchFailureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class FetchFailureReasonTest {

    @Nested
    @DisplayName("HTTP 상태 코드 분류")
    class StatusTests {

        @ParameterizedTest
        @CsvSource({
                "429, HTTP_RATE_LIMITED, true",
                "500, HTTP_SERVER_ERROR, true",
                "503, HTTP_SERVER_ERROR, true",
                "404, HTTP_CLIENT_ERROR, false",
                "403, HTTP_CLIENT_ERROR, false"
        })
        @DisplayName("상태 코드별 실패 사유와 재시도 여부")
        void classifiesStatus(int status, FetchFailureReason expected, boolean transientFailure) {
            FetchFailureReason reason = FetchFailureReason.fromStatus(status);

            assertThat(reason).isEqualTo(expected);
            assertThat(reason.isTransient()).isEqualTo(transientFailure);
        }
    }

    @Nested
    @DisplayName("예외 분류")
    class ExceptionTests {

        @Test
        @DisplayName("타임아웃은 재시도 대상이다")
        void timeoutIsTransient() {
            FetchFailureReason reason = FetchFailureReason.fromException(new TimeoutException("Did not observe any item"));

            assertThat(reason).isEqualTo(FetchFailureReason.TIMEOUT);
            assertThat(reason.isTransient()).isTrue();
        }

        @Test
        @DisplayName("WebClientResponseException은 상태 코드로 분류한다")
        void responseExceptionUsesStatus() {
            WebClientResponseException e = new WebClientResponseException(502, "Bad Gateway",
                    HttpHeaders.EMPTY, new byte[0], null);

            assertThat(FetchFailureReason.fromException(e)).isEqualTo(FetchFailureReason.HTTP_SERVER_ERROR);
        }

        @Test
        @DisplayName("WebClientRequestException은 원인 예외로 분류한다")
        void requestExceptionUnwrapsCause() {
            WebClientRequestException e = new WebClientRequestException(new UnknownHostException("docs.invalid"),
                    HttpMethod.GET, URI.create("https://docs.invalid/"), HttpHeaders.EMPTY);

            assertThat(FetchFailureReason.fromException(e)).isEqualTo(FetchFailureReason.DNS_RESOLUTION_FAILED);
        }

        @Test
        @DisplayName("연결 거부는 재시도 대상이다")
        void connectionRefused() {
            FetchFailureReason reason = FetchFailureReason.fromException(new ConnectException("Connection refused"));

            assertThat(reason).isEqualTo(FetchFailureReason.CONNECTION_REFUSED);
            assertThat(reason.isTransient()).isTrue();
        }

        @Test
        @DisplayName("사유를 가진 예외는 그 사유를 그대로 사용한다")
        void carrierKeepsReason() {
            FetchFailureException e = FetchFailureException.emptyContent("https://docs.example.com/a");

            assertThat(FetchFailureReason.fromException(e)).isEqualTo(FetchFailureReason.EMPTY_CONTENT);
            assertThat(e.getErrorCode()).isEqualTo("FETCH_EMPTY_CONTENT");
        }

        @Test
        @DisplayName("null은 UNKNOWN")
        void nullIsUnknown() {
            assertThat(FetchFailureReason.fromException(null)).isEqualTo(FetchFailureReason.UNKNOWN);
        }
    }
}
