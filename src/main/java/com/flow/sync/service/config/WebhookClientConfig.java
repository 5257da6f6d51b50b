package com.flow.sync.service.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client used for webhook deliveries.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class WebhookClientConfig {

    private final WebhookConfig webhookConfig;

    @Bean(name = "webhookRestClient")
    public RestClient webhookRestClient(RestClient.Builder builder) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(webhookConfig.getTimeoutMs());
        requestFactory.setReadTimeout(webhookConfig.getTimeoutMs());

        log.info("Initializing webhook client: timeout={}ms, maxRetries={}",
                webhookConfig.getTimeoutMs(), webhookConfig.getMaxRetries());
        return builder.requestFactory(requestFactory).build();
    }
}
