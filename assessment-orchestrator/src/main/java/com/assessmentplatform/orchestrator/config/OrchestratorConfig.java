package com.assessmentplatform.orchestrator.config;

import com.assessmentplatform.common.specialist.NavigationPolicy;
import com.assessmentplatform.orchestrator.adapter.LinearNavigationPolicy;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class OrchestratorConfig {

    @Value("${services.specialists.base-url}")
    private String specialistsUrl;

    @Value("${services.specialists.timeout-ms:30000}")
    private long specialistTimeoutMs;

    @Value("${services.report-storage.base-url}")
    private String reportStorageUrl;

    /**
     * Client for every decision service. The socket read timeout sits slightly above the
     * per-call timeout the transport enforces, so the transport's timeout is what callers see.
     */
    @Bean
    public WebClient specialistClient(WebClient.Builder builder) {
        long readTimeoutMs = specialistTimeoutMs + 5_000;
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofMillis(readTimeoutMs))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutMs, TimeUnit.MILLISECONDS))
            );

        return builder
            .baseUrl(specialistsUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public WebClient reportStorageClient(WebClient.Builder builder) {
        return builder.baseUrl(reportStorageUrl).build();
    }

    @Bean
    public NavigationPolicy navigationPolicy() {
        return new LinearNavigationPolicy();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            LoggerFactory.getLogger(OrchestratorConfig.class)
                .debug("Outbound specialist request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
