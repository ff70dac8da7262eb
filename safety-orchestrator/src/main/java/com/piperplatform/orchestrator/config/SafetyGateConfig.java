package com.piperplatform.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.piperplatform.common.exception.GenerationException;
import com.piperplatform.orchestrator.ai.AnthropicMessagesClient;
import com.piperplatform.orchestrator.ai.AnthropicTextSignalClassifier;
import com.piperplatform.orchestrator.ai.KeywordTextSignalClassifier;
import com.piperplatform.orchestrator.ai.TextSignalClassifier;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class SafetyGateConfig {

    private static final Logger log = LoggerFactory.getLogger(SafetyGateConfig.class);

    @Value("${anthropic.base-url:https://api.anthropic.com}")
    private String anthropicBaseUrl;

    @Value("${safety-gate.signals.classifier:keyword}")
    private String classifierMode;

    @Value("${safety-gate.signals.timeout-ms:1500}")
    private long classifierTimeoutMs;

    @Bean
    public WebClient anthropicClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 3_000)
            .responseTimeout(Duration.ofSeconds(10))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(10, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(anthropicBaseUrl)
            .defaultHeader("anthropic-version", "2023-06-01")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(errorStatusFilter())
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public TextSignalClassifier textSignalClassifier(AnthropicMessagesClient messagesClient,
                                                     ObjectMapper objectMapper) {
        if ("llm".equalsIgnoreCase(classifierMode)) {
            log.info("Text signal classifier: llm (timeoutMs={}, keyword fallback)", classifierTimeoutMs);
            return new AnthropicTextSignalClassifier(messagesClient, objectMapper,
                Duration.ofMillis(classifierTimeoutMs));
        }
        log.info("Text signal classifier: keyword");
        return new KeywordTextSignalClassifier();
    }

    /** Drives the inactivity timers and the generator timeout. */
    @Bean
    public Scheduler safetyGateScheduler() {
        return Schedulers.parallel();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    private ExchangeFilterFunction errorStatusFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().isError()) {
                return Mono.error(new GenerationException("AnthropicClient",
                    "Anthropic API returned " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
