package com.storefront.common.exception;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;

import java.net.URI;
import java.util.Locale;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    private Locale defaultLocale;

    @BeforeEach
    void setUp() {
        defaultLocale = Locale.getDefault();
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(defaultLocale);
    }

    @Test
    void handleBusinessException_insufficientStock_conflictWithQuantities() {
        ResponseEntity<ProblemDetail> response =
                handler.handleBusinessException(new InsufficientStockException(UUID.randomUUID(), 3, 5));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        ProblemDetail problem = response.getBody();
        assertNotNull(problem);
        assertEquals(URI.create("https://storefront.dev/errors/insufficient_stock"), problem.getType());
        assertEquals("INSUFFICIENT_STOCK", problem.getProperties().get("code"));
        assertEquals(3, problem.getProperties().get("available"));
        assertEquals(5, problem.getProperties().get("requested"));
    }

    @Test
    void handleBusinessException_turkishDefaultLocale_typeUriStaysAscii() {
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));

        ResponseEntity<ProblemDetail> response = handler.handleBusinessException(
                new MalformedPaymentEventException("Payment event has no event type"));

        ProblemDetail problem = response.getBody();
        assertNotNull(problem);
        assertEquals(URI.create("https://storefront.dev/errors/invalid_payment_event"), problem.getType());
    }
}
