package org.tcgstats.metalens_api.modules.meta_analytics.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param minMatches directional observations needed before a win rate is reported
 * @param maxDays    longest period a request may ask for
 */
@ConfigurationProperties(prefix = "metalens.meta")
public record MetaAnalyticsProperties(
        @DefaultValue("3") int minMatches,
        @DefaultValue("365") int maxDays) {}
