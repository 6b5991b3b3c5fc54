package com.clinical.icdlookup.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;

/**
 * Builds the single {@link WebClient} shared by the token manager and the
 * registry search client.
 * <p>
 * Every caller supplies an absolute URI, so no base URL is set here.
 */
@Configuration
@Slf4j
public class WebClientConfiguration {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private static final Duration POOL_ACQUIRE_TIMEOUT = Duration.ofSeconds(2);

    private static final int MAX_CONNECTIONS = 20;

    @Bean
    @Qualifier("registryWebClient")
    public WebClient registryWebClient(@Qualifier("registryObjectMapper") final ObjectMapper mapper,
                                       final RegistryProperties props) {

        /* --- JSON codecs wired to the custom ObjectMapper ------------------ */
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> {
                    cfg.defaultCodecs()
                            .jackson2JsonEncoder(new Jackson2JsonEncoder(mapper, MediaType.APPLICATION_JSON));
                    cfg.defaultCodecs()
                            .jackson2JsonDecoder(new Jackson2JsonDecoder(mapper, MediaType.APPLICATION_JSON));
                })
                .build();

        ConnectionProvider pool = ConnectionProvider.builder("icd-registry-pool")
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(POOL_ACQUIRE_TIMEOUT)
                .build();

        HttpClient tcpClient = HttpClient.create(pool)
                .compress(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) CONNECT_TIMEOUT.toMillis())
                .responseTimeout(props.getTimeout())
                // SIMPLE logs connection events only; payloads carry the bearer token and client secret
                .wiretap("reactor.netty.http.client.HttpClient",
                        LogLevel.DEBUG, AdvancedByteBufFormat.SIMPLE);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(tcpClient))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .filter(logRequest())
                .filter(logResponse())
                .exchangeStrategies(strategies)
                .build();
    }

    // Authorization header values are deliberately left out of the log line.
    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(req -> {
            log.debug("--> {} {}", req.method(), req.url());
            return Mono.just(req);
        });
    }

    private static ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(res -> {
            log.debug("<-- {}  {}", res.statusCode().value(), res.headers().contentType().orElse(null));
            return Mono.just(res);
        });
    }
}
