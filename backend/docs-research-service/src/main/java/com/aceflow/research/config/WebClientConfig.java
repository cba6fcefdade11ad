package com.aceflow.research.config;

import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

    private final ResearchProperties properties;

    /**
     * 문서 수집용 WebClient.
     * 요청 단위 타임아웃은 fetcher에서 적용하고, 여기서는 연결 타임아웃과 리다이렉트만 설정합니다.
     */
    @Bean
    public WebClient documentWebClient() {
        ResearchProperties.Fetch fetch = properties.getFetch();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) fetch.getConnectTimeout().toMillis())
                .responseTimeout(fetch.getTimeout())
                .followRedirect(true);

        // documentation pages regularly exceed the 256KB codec default
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(fetch.getMaxBodyBytes()))
                .build();

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .defaultHeader(HttpHeaders.USER_AGENT, fetch.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.TEXT_HTML_VALUE + ", text/markdown, text/plain;q=0.9, */*;q=0.5")
                .build();
    }
}
