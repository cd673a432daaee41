package org.tcgstats.metalens_api.modules.meta_analytics.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.tcgstats.metalens_api.modules.meta_analytics.engine.MetaAnalyticsEngine;
import org.tcgstats.metalens_api.modules.meta_analytics.engine.MetaRowSource;

import java.time.Clock;

@Configuration
@EnableRetry
@EnableConfigurationProperties(MetaAnalyticsProperties.class)
class MetaAnalyticsConfig {

    private static final Logger log = LoggerFactory.getLogger(MetaAnalyticsConfig.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    MetaAnalyticsEngine metaAnalyticsEngine(MetaRowSource rowSource, Clock clock, MetaAnalyticsProperties p) {
        log.info("Meta analytics engine: win rates need at least {} matches, periods capped at {} days",
                p.minMatches(), p.maxDays());
        return new MetaAnalyticsEngine(rowSource, clock, p.minMatches());
    }
}
