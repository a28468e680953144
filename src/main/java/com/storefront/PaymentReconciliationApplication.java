package com.storefront;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Payment Confirmation and Stock Reconciliation Service
 *
 * Turns "payment succeeded" notifications from the payment provider into paid orders and
 * stock deductions, exactly once per payment reference.
 *
 * Architecture:
 * - Signed webhooks queued on Kafka, consumed with retry topics and a DLT
 * - Insert-first idempotency log keyed by payment reference
 * - One database transaction per settlement (order lock, stock check, deductions)
 * - Conditional stock updates; stock can never go negative
 * - Refund through the provider when stock ran out, with admin escalation on failure
 * - Scheduled verification of payments whose webhook never arrived
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableScheduling
public class PaymentReconciliationApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentReconciliationApplication.class, args);
    }
}
