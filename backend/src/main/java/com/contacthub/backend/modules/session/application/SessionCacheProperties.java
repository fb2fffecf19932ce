package com.contacthub.backend.modules.session.application;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param store     {@code redis} or {@code memory}
 * @param ttl       lifetime of a cached projection
 * @param keyPrefix prefix applied to every key in the backing store
 */
@ConfigurationProperties(prefix = "app.session-cache")
public record SessionCacheProperties(
        @DefaultValue("redis") String store,
        @DefaultValue("1h") Duration ttl,
        @DefaultValue("user:") String keyPrefix
) {
}
