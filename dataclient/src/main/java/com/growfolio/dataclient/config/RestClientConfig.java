package com.growfolio.dataclient.config;

/*
 * 09/22/2026 - 10:07 AM
 * @author Growfolio Engineering
 */

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * REST client for the Growfolio API.
 */
@Configuration
public class RestClientConfig {

    private final GrowfolioProperties properties;

    public RestClientConfig(GrowfolioProperties properties) {
        this.properties = properties;
    }

    @Bean
    public RestClient growfolioRestClient() {
        return builderFor(properties.api()).build();
    }

    /**
     * Pre-configured builder; tests bind a mock server to it before building.
     */
    public static RestClient.Builder builderFor(GrowfolioProperties.ApiConfig api) {
        return RestClient.builder()
                .baseUrl(api.baseUrl())
                .requestFactory(createRequestFactory(api.timeout()))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
    }

    private static SimpleClientHttpRequestFactory createRequestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        return factory;
    }
}
