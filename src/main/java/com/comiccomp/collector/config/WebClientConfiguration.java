package com.comiccomp.collector.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;

/**
 * Builds the {@link WebClient.Builder} every {@code HttpListingSource} clones.
 * <p>
 * All marketplace feeds share one connection pool sized by {@code collection.http}.
 * The netty response timeout is the longest marketplace {@code timeout}, so it never
 * fires before a marketplace's own time limiter does.
 * </p>
 */
@Configuration
@Slf4j
public class WebClientConfiguration {

    private static final String POOL_NAME = "marketplace-feeds";

    @Bean
    public WebClient.Builder webClientBuilder(@Qualifier("collectorObjectMapper") final ObjectMapper mapper,
                                              final CollectionProperties collection,
                                              final MarketplaceProperties marketplaces) {
        CollectionProperties.Http http = collection.getHttp();

        // feeds are only read, so only the decoder uses the collector mapper
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> {
                    cfg.defaultCodecs()
                            .jackson2JsonDecoder(new Jackson2JsonDecoder(mapper, MediaType.APPLICATION_JSON));
                    cfg.defaultCodecs().maxInMemorySize((int) http.getMaxInMemorySize().toBytes());
                })
                .build();

        ConnectionProvider pool = ConnectionProvider.builder(POOL_NAME)
                .maxConnections(http.getMaxConnections())
                .pendingAcquireTimeout(http.getPendingAcquireTimeout())
                .build();

        Duration responseTimeout = longestTimeout(marketplaces);
        HttpClient httpClient = HttpClient.create(pool)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) http.getConnectTimeout().toMillis())
                .responseTimeout(responseTimeout);
        if (http.isWiretap()) {
            httpClient = httpClient.wiretap("reactor.netty.http.client.HttpClient",
                    LogLevel.DEBUG, AdvancedByteBufFormat.TEXTUAL);
        }
        log.info("Marketplace HTTP pool: {} connections, response timeout {}", http.getMaxConnections(),
                responseTimeout);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .filter(logRequest())
                .filter(logThrottling())
                .exchangeStrategies(strategies);
    }

    /**
     * @param marketplaces configured marketplaces
     * @return the longest per-marketplace timeout, or the {@link MarketplaceCfg} default when none is configured
     */
    static Duration longestTimeout(final MarketplaceProperties marketplaces) {
        return marketplaces.getConfigs().values().stream()
                .map(MarketplaceCfg::getTimeout)
                .max(Duration::compareTo)
                .orElseGet(() -> new MarketplaceCfg().getTimeout());
    }

    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(req -> {
            log.debug("--> {} {}", req.method(), req.url());
            return Mono.just(req);
        });
    }

    /** Marketplaces announce their back-off in Retry-After; surface it next to the 429. */
    private static ExchangeFilterFunction logThrottling() {
        return ExchangeFilterFunction.ofResponseProcessor(res -> {
            if (res.statusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                log.warn("<-- 429 throttled, Retry-After: {}",
                        res.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER));
            } else {
                log.debug("<-- {}", res.statusCode().value());
            }
            return Mono.just(res);
        });
    }
}
