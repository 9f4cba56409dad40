package com.anomaly.alerting.notification;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class NotificationConfig {

    /** HTTP client for Slack and webhook delivery; connect and read bounded by the channel timeout. */
    @Bean
    public RestTemplate notificationRestTemplate(@Value("${anomaly.notification.timeout-ms:5000}") int timeoutMs) {
        RestTemplate restTemplate = new RestTemplate();
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        restTemplate.setRequestFactory(factory);
        return restTemplate;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService notificationExecutor(@Value("${anomaly.notification.pool-size:4}") int poolSize) {
        return Executors.newFixedThreadPool(poolSize);
    }
}
