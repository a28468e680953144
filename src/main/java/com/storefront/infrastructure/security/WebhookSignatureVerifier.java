package com.storefront.infrastructure.security;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Verifies the provider's webhook signature: hex HMAC-SHA512 of the raw body, keyed by the
 * provider secret key.
 */
@Component
public class WebhookSignatureVerifier {

    public static final String SIGNATURE_HEADER = "x-paystack-signature";

    private static final String ALGORITHM = "HmacSHA512";

    private final SecretKeySpec key;

    public WebhookSignatureVerifier(@Value("${app.payment-provider.secret-key}") String secretKey) {
        this.key = new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public boolean isValid(String rawBody, String signature) {
        if (rawBody == null || signature == null || signature.isBlank()) {
            return false;
        }

        byte[] expected = sign(rawBody).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);

        // constant time
        return MessageDigest.isEqual(expected, actual);
    }

    public String sign(String rawBody) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return HexFormat.of().formatHex(mac.doFinal(rawBody.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA512 unavailable", e);
        }
    }
}
