package com.treasurylens.indexer;

import com.treasurylens.domain.Chain;

import java.time.Duration;

/**
 * Indexer endpoints. Testnet chains use testnetUrl unless testnetRoutesToMainnet is set.
 * apiKey, when present, is sent as a bearer token.
 */
public record IndexerSettings(
        String url,
        String testnetUrl,
        String apiKey,
        boolean testnetRoutesToMainnet,
        Duration timeout
) {

    public IndexerSettings {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("indexer url is required");
        }
        timeout = timeout != null ? timeout : Duration.ofSeconds(15);
    }

    public String urlFor(Chain chain) {
        if (chain.isTestnet() && !testnetRoutesToMainnet && testnetUrl != null && !testnetUrl.isBlank()) {
            return testnetUrl;
        }
        return url;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
