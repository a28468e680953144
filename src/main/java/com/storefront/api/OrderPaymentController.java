package com.storefront.api;

import com.storefront.api.dto.ApiResponse;
import com.storefront.domain.model.VerificationResult;
import com.storefront.domain.service.PaymentVerificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderPaymentController {

    private final PaymentVerificationService verificationService;

    /**
     * Check one order's payment with the provider now instead of waiting for the webhook.
     *
     * POST /api/v1/orders/{orderNumber}/verify-payment
     */
    @PostMapping("/{orderNumber}/verify-payment")
    public ResponseEntity<ApiResponse<VerificationResult>> verifyPayment(@PathVariable String orderNumber) {
        log.info("Manual payment verification requested for order {}", orderNumber);
        return ResponseEntity.ok(ApiResponse.ok(verificationService.verify(orderNumber)));
    }
}
