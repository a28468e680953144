package com.storefront.domain.service;

import com.storefront.common.exception.EventInProgressException;
import com.storefront.common.exception.MalformedPaymentEventException;
import com.storefront.domain.model.PaymentEvent;
import com.storefront.domain.model.ProcessingOutcome;

/**
 * Single entry point for provider events, shared by the queue consumer and the inline
 * verification paths.
 */
public interface PaymentEventProcessor {

    /**
     * Apply a provider event at most once.
     *
     * @throws MalformedPaymentEventException if the event is missing its type or reference; never retry
     * @throws EventInProgressException if another worker is processing the same reference; retry later
     */
    ProcessingOutcome process(PaymentEvent event);
}
