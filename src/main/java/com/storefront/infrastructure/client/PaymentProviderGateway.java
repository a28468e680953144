package com.storefront.infrastructure.client;

import com.storefront.common.exception.BusinessException;
import com.storefront.common.exception.ErrorCode;
import com.storefront.common.exception.RefundFailedException;
import com.storefront.infrastructure.client.PaymentProviderClient.ProviderResponse;
import com.storefront.infrastructure.client.PaymentProviderClient.RefundData;
import com.storefront.infrastructure.client.PaymentProviderClient.RefundRequest;
import com.storefront.infrastructure.client.PaymentProviderClient.VerificationData;
import feign.FeignException;
import feign.RetryableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns payment provider calls into a binary outcome.
 *
 * A refund either succeeds or throws {@link RefundFailedException}: non-2xx responses,
 * {@code status=false}, timeouts and I/O errors all count as failure.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentProviderGateway {

    private static final int MAX_BODY_IN_MESSAGE = 300;

    private final PaymentProviderClient client;

    public void refund(String reference) {
        ProviderResponse<RefundData> response;
        try {
            response = client.refund(new RefundRequest(reference));
        } catch (FeignException e) {
            throw new RefundFailedException(reference, describe(e), e);
        }

        if (response == null) {
            throw new RefundFailedException(reference, "Empty response from payment provider");
        }
        if (!response.status()) {
            throw new RefundFailedException(reference,
                    response.message() == null ? "Payment provider rejected the refund" : response.message());
        }

        log.info("Refund accepted by payment provider for {} (status: {})",
                reference, response.data() == null ? "unknown" : response.data().status());
    }

    /**
     * Current state of a transaction at the provider.
     *
     * @throws BusinessException with PAYMENT_PROVIDER_ERROR if the provider cannot be asked
     */
    public VerificationData verify(String reference) {
        ProviderResponse<VerificationData> response;
        try {
            response = client.verify(reference);
        } catch (FeignException e) {
            throw new BusinessException(ErrorCode.PAYMENT_PROVIDER_ERROR,
                    "Verification of " + reference + " failed: " + describe(e), e);
        }

        if (response == null || !response.status() || response.data() == null) {
            throw new BusinessException(ErrorCode.PAYMENT_PROVIDER_ERROR,
                    "Verification of " + reference + " failed: "
                            + (response == null ? "empty response" : response.message()));
        }
        return response.data();
    }

    private static String describe(FeignException e) {
        if (e instanceof RetryableException) {
            return "Payment provider unreachable: " + e.getMessage();
        }
        String body = e.contentUTF8();
        if (body != null && body.length() > MAX_BODY_IN_MESSAGE) {
            body = body.substring(0, MAX_BODY_IN_MESSAGE);
        }
        return "Payment provider returned HTTP " + e.status()
                + (body == null || body.isBlank() ? "" : ": " + body);
    }
}
