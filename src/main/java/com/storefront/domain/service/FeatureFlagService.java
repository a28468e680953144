package com.storefront.domain.service;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.storefront.infrastructure.persistence.repository.SystemSettingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Read-through cache over system settings used as feature flags.
 *
 * A setting that does not exist falls back to {@code app.settings.default-enabled}. A lookup
 * that fails is treated as disabled and not cached, so the next call tries again.
 */
@Slf4j
@Service
public class FeatureFlagService {

    public static final String ORDER_CONFIRMATION_EMAIL = "orderConfirmationEmail";

    private final SystemSettingRepository settingRepository;
    private final boolean defaultEnabled;
    private final LoadingCache<String, Boolean> flags;

    public FeatureFlagService(SystemSettingRepository settingRepository,
                              @Value("${app.settings.cache-ttl:PT30S}") Duration cacheTtl,
                              @Value("${app.settings.default-enabled:true}") boolean defaultEnabled) {
        this.settingRepository = settingRepository;
        this.defaultEnabled = defaultEnabled;
        this.flags = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(256)
                .build(this::load);
    }

    public boolean isEnabled(String key) {
        try {
            return flags.get(key);
        } catch (RuntimeException e) {
            log.error("Could not read setting {}, treating it as disabled: {}", key, e.getMessage(), e);
            return false;
        }
    }

    public void invalidate(String key) {
        flags.invalidate(key);
    }

    private Boolean load(String key) {
        return settingRepository.findById(key)
                .map(setting -> parse(setting.getValue()))
                .orElse(defaultEnabled);
    }

    private static boolean parse(String value) {
        if (value == null) {
            return false;
        }
        String normalized = value.trim();
        return !(normalized.equalsIgnoreCase("false")
                || normalized.equals("0")
                || normalized.equalsIgnoreCase("off")
                || normalized.equalsIgnoreCase("no"));
    }
}
