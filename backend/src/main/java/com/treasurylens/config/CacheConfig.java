package com.treasurylens.config;

import com.treasurylens.cache.TreasuryCaches;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine-backed ruleset caches: current/queued 5 min, splits and fund access limits 2 min, history permanent.
 */
@Configuration
@EnableConfigurationProperties(TreasuryLensProperties.class)
public class CacheConfig {

    @Bean
    public TreasuryCaches treasuryCaches(TreasuryLensProperties properties) {
        TreasuryLensProperties.Cache cache = properties.getCache();
        return new TreasuryCaches(cache.getRulesetTtl(), cache.getSplitsTtl(), cache.getMaxSize());
    }
}
