package com.riskmgmt.quant.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.riskmgmt.quant.config.QuantEngineProperties;
import com.riskmgmt.quant.model.RiskAssessmentReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Bounded in-memory memo of completed reports keyed by fingerprint.
 */
@Component
public class AssessmentCache {

    private static final Logger log = LoggerFactory.getLogger(AssessmentCache.class);

    private final Cache<String, RiskAssessmentReport> cache;
    private final boolean enabled;

    public AssessmentCache(QuantEngineProperties properties) {
        QuantEngineProperties.Cache config = properties.getCache();
        this.enabled = config.isEnabled();
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.getMaximumSize())
                .expireAfterWrite(config.getExpireAfterWrite())
                .recordStats()
                .build();
        log.info("Assessment cache {} (maxSize={}, ttl={})",
                enabled ? "enabled" : "disabled", config.getMaximumSize(), config.getExpireAfterWrite());
    }

    public Optional<RiskAssessmentReport> get(String fingerprint) {
        if (!enabled) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(fingerprint));
    }

    public void put(String fingerprint, RiskAssessmentReport report) {
        if (enabled) {
            cache.put(fingerprint, report);
        }
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        return cache.estimatedSize();
    }
}
