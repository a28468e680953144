package com.storefront.infrastructure.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Payment provider REST API.
 *
 * Timeouts, authentication and the disabled Feign retryer come from
 * {@link com.storefront.config.PaymentProviderClientConfig}.
 */
@FeignClient(name = "payment-provider", url = "${app.payment-provider.base-url:https://api.paystack.co}")
public interface PaymentProviderClient {

    /** Full refund of a transaction, identified by its reference. */
    @PostMapping("/refund")
    ProviderResponse<RefundData> refund(@RequestBody RefundRequest request);

    @GetMapping("/transaction/verify/{reference}")
    ProviderResponse<VerificationData> verify(@PathVariable("reference") String reference);

    record RefundRequest(String transaction) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ProviderResponse<T>(boolean status, String message, T data) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RefundData(String status, Long amount, String currency) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record VerificationData(
            String reference,
            String status,
            Long amount,
            String currency,
            String channel,
            @JsonProperty("paid_at") String paidAt,
            @JsonProperty("gateway_response") String gatewayResponse) {}
}
