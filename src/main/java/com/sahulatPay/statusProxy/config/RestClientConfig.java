package com.sahulatPay.statusProxy.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configuration for the RestClient used to call the SahulatPay lookup endpoints.
 */
@Configuration
public class RestClientConfig {
    
    /**
     * Creates the RestClient with connect and read timeouts.
     * 
     * @param builder RestClient.Builder provided by Spring Boot
     * @param timeoutMs Timeout in milliseconds, applied to connect and read
     * @return Configured RestClient instance
     */
    @Bean
    public RestClient sahulatRestClient(
            RestClient.Builder builder,
            @Value("${sahulat.api.timeout:15000}") int timeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);
        
        return builder
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
