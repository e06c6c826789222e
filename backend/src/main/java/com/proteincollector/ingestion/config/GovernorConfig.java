package com.proteincollector.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proteincollector.common.AccessGovernor;
import com.proteincollector.common.Sleeper;
import com.proteincollector.common.cache.CachedApiClient;
import com.proteincollector.common.cache.ResponseCache;
import com.proteincollector.common.error.ErrorHandler;
import com.proteincollector.common.ratelimit.RateLimitManager;
import com.proteincollector.common.retry.RetryController;
import com.proteincollector.ingestion.client.InterProClient;
import com.proteincollector.ingestion.client.UniProtClient;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the API access governor (rate limits, retry, response cache) and the REST clients that use it.
 * One RateLimitManager and one ResponseCache per application; limiters are created for every configured API.
 */
@Configuration
@EnableConfigurationProperties({ RateLimitProperties.class, RetryProperties.class, CacheProperties.class, ApiProperties.class })
@Slf4j
public class GovernorConfig {

    @Bean
    public ErrorHandler errorHandler() {
        return new ErrorHandler();
    }

    @Bean
    public RateLimitManager rateLimitManager(RateLimitProperties properties) {
        RateLimitManager manager = new RateLimitManager(
                properties.isMonitoringEnabled(),
                properties.isReportingEnabled(),
                properties.getViolationHistoryLimit(),
                Clock.systemUTC(),
                Sleeper.threadSleep(),
                Schedulers.parallel());
        properties.getApis().forEach((name, api) -> manager.createLimiter(name, properties.toConfig(api)));
        return manager;
    }

    @Bean
    public RetryController retryController(RetryProperties properties, ErrorHandler errorHandler) {
        return new RetryController(properties.toPolicy(), errorHandler, Sleeper.threadSleep(), Schedulers.parallel());
    }

    @Bean(destroyMethod = "close")
    public ResponseCache responseCache(CacheProperties properties, ObjectProvider<ObjectMapper> objectMapper) {
        return new ResponseCache(properties.toConfig(), objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public CachedApiClient cachedApiClient(ResponseCache responseCache) {
        return new CachedApiClient(responseCache);
    }

    @Bean
    public AccessGovernor accessGovernor(RateLimitManager rateLimitManager, RetryController retryController,
                                         CachedApiClient cachedApiClient) {
        return new AccessGovernor(rateLimitManager, retryController, cachedApiClient);
    }

    @Bean
    public UniProtClient uniProtClient(ApiProperties apiProperties, ObjectProvider<WebClient.Builder> webClientBuilder,
                                       AccessGovernor accessGovernor, ObjectProvider<ObjectMapper> objectMapper) {
        WebClient webClient = webClient(webClientBuilder, apiProperties, apiProperties.getUniprotBaseUrl());
        return new UniProtClient(webClient, accessGovernor, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public InterProClient interProClient(ApiProperties apiProperties, ObjectProvider<WebClient.Builder> webClientBuilder,
                                         AccessGovernor accessGovernor, ObjectProvider<ObjectMapper> objectMapper) {
        WebClient webClient = webClient(webClientBuilder, apiProperties, apiProperties.getInterproBaseUrl());
        return new InterProClient(webClient, accessGovernor, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    private static WebClient webClient(ObjectProvider<WebClient.Builder> builder, ApiProperties apiProperties,
                                       String baseUrl) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, apiProperties.getConnectTimeoutSeconds() * 1000)
                .responseTimeout(Duration.ofSeconds(apiProperties.getReadTimeoutSeconds()));
        log.info("REST client configured baseUrl={} connectTimeoutSeconds={} readTimeoutSeconds={}",
                baseUrl, apiProperties.getConnectTimeoutSeconds(), apiProperties.getReadTimeoutSeconds());
        return builder.getIfAvailable(WebClient::builder)
                .clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
