package com.treasurylens.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All treasurylens.* settings. Defaults here match application.yml; the yml adds the public RPC endpoint lists.
 */
@ConfigurationProperties(prefix = "treasurylens")
@NoArgsConstructor
@Getter
@Setter
public class TreasuryLensProperties {

    private Indexer indexer = new Indexer();
    private Rpc rpc = new Rpc();
    private Gates gates = new Gates();
    private Cache cache = new Cache();
    private Debug debug = new Debug();
    private Watch watch = new Watch();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Indexer {

        /** Mainnet GraphQL endpoint. */
        private String url = "https://bendystraw.xyz/graphql";

        /** Endpoint for testnet chains. */
        private String testnetUrl = "https://testnet.bendystraw.xyz/graphql";

        /** Sent as a bearer token when set. */
        private String apiKey;

        /** Send testnet chain queries to the mainnet endpoint. */
        private boolean testnetRoutesToMainnet = false;

        private Duration timeout = Duration.ofSeconds(15);
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Rpc {

        /** Endpoint URLs per chain id, in fallback order. */
        private Map<Long, List<String>> chains = new LinkedHashMap<>();

        private Duration perAttemptTimeout = Duration.ofSeconds(15);

        /** Attempts per call across the endpoint list; 0 means one per endpoint. */
        private int maxAttempts = 0;

        /** Global eth_call budget for this instance. */
        private int maxRequestsPerSecond = 50;

        /** How long a call may wait for a limiter permit before failing. */
        private Duration limiterTimeout = Duration.ofSeconds(2);
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Gates {
        private Gate indexer = new Gate(3, Duration.ofSeconds(120), 2.0, Duration.ofMinutes(10));
        private Gate rpc = new Gate(5, Duration.ofSeconds(60), 2.0, Duration.ofMinutes(5));
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Gate {
        private int failureThreshold;
        private Duration cooldown;
        private double backoffMultiplier = 2.0;
        private Duration maxCooldown;

        public Gate(int failureThreshold, Duration cooldown, double backoffMultiplier, Duration maxCooldown) {
            this.failureThreshold = failureThreshold;
            this.cooldown = cooldown;
            this.backoffMultiplier = backoffMultiplier;
            this.maxCooldown = maxCooldown;
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Cache {
        private Duration rulesetTtl = Duration.ofMinutes(5);
        private Duration splitsTtl = Duration.ofMinutes(2);
        private long maxSize = 10_000;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Debug {
        /** Recent failure records kept for /api/v1/debug/failures. */
        private int bufferSize = 200;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Watch {

        /** Projects whose cycle changes are polled, as "chainId:projectId". */
        private List<String> projects = new ArrayList<>();

        private long pollIntervalMs = 60_000;
    }
}
