package com.demo.underwriting.config;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpConfig {

    @Bean
    public RestTemplate restTemplate(@Value("${http.connectTimeoutMs:5000}") int connectTimeoutMs,
                                     @Value("${http.readTimeoutMs:20000}") long readTimeoutMs,
                                     @Value("${http.maxConnections:256}") int maxConnections,
                                     @Value("${profileSearch.lookupTimeoutMs:20000}") long lookupTimeoutMs) {
        // lookup hết hạn thì socket cũng phải nhả thread ra
        Timeout waitLimit = Timeout.ofMilliseconds(responseTimeoutMs(readTimeoutMs, lookupTimeoutMs));
        PoolingHttpClientConnectionManager connections = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(maxConnections)
                .setMaxConnPerRoute(maxConnections)
                .build();
        RequestConfig rc = RequestConfig.custom()
                .setResponseTimeout(waitLimit)
                .setConnectionRequestTimeout(waitLimit)
                .build();
        CloseableHttpClient client = HttpClients.custom()
                .setConnectionManager(connections)
                .setDefaultRequestConfig(rc)
                .build();
        HttpComponentsClientHttpRequestFactory f = new HttpComponentsClientHttpRequestFactory(client);
        f.setConnectTimeout(connectTimeoutMs);
        return new RestTemplate(f);
    }

    /** Never wait on the socket longer than the lookup that is waiting on it. */
    static long responseTimeoutMs(long readTimeoutMs, long lookupTimeoutMs) {
        return Math.min(readTimeoutMs, lookupTimeoutMs);
    }
}
