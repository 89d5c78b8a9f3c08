package com.notiflow.notification.delivery.config;

import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Shared builder for outbound channel calls. The service runs on the servlet stack and only
 * borrows the Reactor Netty client. Per-call deadlines are set by each channel.
 */
@Slf4j
@Configuration
public class WebClientConfig {

    private static final int CONNECT_TIMEOUT_MS = 5000;

    @Bean
    public WebClient.Builder webClientBuilder() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .responseTimeout(Duration.ofSeconds(30));

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .filter(logRequest());
    }

    private static ExchangeFilterFunction logRequest() {
        // the path carries the Bitrix webhook token, so only the host is logged
        return ExchangeFilterFunction.ofRequestProcessor(request -> {
            log.debug("Outbound {} to {}", request.method(), request.url().getHost());
            return Mono.just(request);
        });
    }
}
