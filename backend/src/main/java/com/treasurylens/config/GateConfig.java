package com.treasurylens.config;

import com.treasurylens.resilience.CircuitGate;
import com.treasurylens.resilience.GateSettings;
import com.treasurylens.resilience.RecentFailuresDebugSink;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * One circuit gate per outbound dependency, sharing the recent-failures sink.
 */
@Configuration
@EnableConfigurationProperties(TreasuryLensProperties.class)
public class GateConfig {

    public static final String INDEXER_GATE = "indexerGate";
    public static final String RPC_GATE = "rpcGate";

    @Bean
    public RecentFailuresDebugSink recentFailuresDebugSink(TreasuryLensProperties properties) {
        return new RecentFailuresDebugSink(Math.max(1, properties.getDebug().getBufferSize()));
    }

    @Bean(name = INDEXER_GATE)
    public CircuitGate indexerGate(TreasuryLensProperties properties, RecentFailuresDebugSink sink) {
        return new CircuitGate("indexer", settings(properties.getGates().getIndexer()), sink);
    }

    @Bean(name = RPC_GATE)
    public CircuitGate rpcGate(TreasuryLensProperties properties, RecentFailuresDebugSink sink) {
        return new CircuitGate("rpc", settings(properties.getGates().getRpc()), sink);
    }

    static GateSettings settings(TreasuryLensProperties.Gate gate) {
        return new GateSettings(gate.getFailureThreshold(), gate.getCooldown(), gate.getBackoffMultiplier(),
                gate.getMaxCooldown());
    }
}
