package com.treasurylens.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.treasurylens.chain.ChainEndpoints;
import com.treasurylens.chain.ContractReader;
import com.treasurylens.chain.ContractResolver;
import com.treasurylens.chain.EvmRpcClient;
import com.treasurylens.chain.ProtocolReader;
import com.treasurylens.chain.WebClientEvmRpcClient;
import com.treasurylens.resilience.CircuitGate;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Chain RPC wiring: transport, per-chain endpoint lists, global eth_call limiter, contract reader and resolver.
 */
@Configuration
@EnableConfigurationProperties(TreasuryLensProperties.class)
public class ChainConfig {

    public static final String RPC_RATE_LIMITER = "rpcRateLimiter";

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean
    public ChainEndpoints chainEndpoints(TreasuryLensProperties properties) {
        TreasuryLensProperties.Rpc rpc = properties.getRpc();
        return new ChainEndpoints(rpc.getChains(), rpc.getPerAttemptTimeout(), rpc.getMaxAttempts());
    }

    @Bean(name = RPC_RATE_LIMITER)
    public RateLimiter rpcRateLimiter(TreasuryLensProperties properties) {
        TreasuryLensProperties.Rpc rpc = properties.getRpc();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, rpc.getMaxRequestsPerSecond()))
                .timeoutDuration(rpc.getLimiterTimeout())
                .build();
        return RateLimiter.of("treasurylens-rpc", config);
    }

    @Bean
    public ContractReader contractReader(EvmRpcClient evmRpcClient, ChainEndpoints chainEndpoints,
                                         @Qualifier(GateConfig.RPC_GATE) CircuitGate rpcGate,
                                         @Qualifier(RPC_RATE_LIMITER) RateLimiter rpcRateLimiter,
                                         ObjectMapper objectMapper) {
        return new ContractReader(evmRpcClient, chainEndpoints, rpcGate, rpcRateLimiter, objectMapper);
    }

    @Bean
    public ContractResolver contractResolver(ContractReader contractReader) {
        return new ContractResolver(contractReader);
    }

    @Bean
    public ProtocolReader protocolReader(ContractReader contractReader) {
        return new ProtocolReader(contractReader);
    }
}
