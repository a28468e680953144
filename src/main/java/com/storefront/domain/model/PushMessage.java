package com.storefront.domain.model;

import java.util.Map;

public record PushMessage(String type, String message, Map<String, Object> data) {
}
