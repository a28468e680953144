package com.storefront.domain.model;

import java.util.Map;

/**
 * Job for the email worker. Rendering happens on the worker side from {@code template}.
 */
public record EmailMessage(String type, String toEmail, String subject, String template,
                           Map<String, Object> variables) {
}
