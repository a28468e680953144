package com.storefront.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Notification received from the payment provider.
 *
 * Only {@code event} and {@code data.reference} are required; the rest of the payload is kept
 * verbatim in {@code rawPayload} for the event log.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaymentEvent {

    private String event;
    private PaymentData data;

    @JsonIgnore
    private String rawPayload;

    public PaymentEventType eventType() {
        return PaymentEventType.from(event);
    }

    public String reference() {
        return data == null ? null : data.getReference();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PaymentData {
        private String reference;
        /** Amount in the currency's minor unit. */
        private Long amount;
        private String currency;
        private String status;
        private String channel;
        @JsonProperty("paid_at")
        private String paidAt;
        @JsonProperty("gateway_response")
        private String gatewayResponse;
    }
}
