package com.storefront.config;

import com.storefront.infrastructure.client.PaymentProviderClient;
import feign.Request;
import feign.RequestInterceptor;
import feign.Retryer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;

import java.util.concurrent.TimeUnit;

/**
 * Feign settings for the payment provider client.
 *
 * Bounded connect and read timeouts; a timeout is treated as a failed call. Feign's own
 * retryer is off: a refund must never be sent twice by the HTTP layer.
 */
@Configuration
@EnableFeignClients(clients = PaymentProviderClient.class)
public class PaymentProviderClientConfig {

    @Value("${app.payment-provider.connect-timeout-ms:5000}")
    private long connectTimeoutMs;

    @Value("${app.payment-provider.read-timeout-ms:30000}")
    private long readTimeoutMs;

    @Value("${app.payment-provider.secret-key}")
    private String secretKey;

    @Bean
    public Request.Options paymentProviderRequestOptions() {
        return new Request.Options(
                connectTimeoutMs, TimeUnit.MILLISECONDS,
                readTimeoutMs, TimeUnit.MILLISECONDS,
                true);
    }

    @Bean
    public Retryer paymentProviderRetryer() {
        return Retryer.NEVER_RETRY;
    }

    @Bean
    public RequestInterceptor paymentProviderAuthInterceptor() {
        return template -> template.header(HttpHeaders.AUTHORIZATION, "Bearer " + secretKey);
    }
}
