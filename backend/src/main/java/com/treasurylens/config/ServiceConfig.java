package com.treasurylens.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.treasurylens.aggregation.SuckerGroupAggregator;
import com.treasurylens.cache.TreasuryCaches;
import com.treasurylens.chain.ContractResolver;
import com.treasurylens.chain.ProtocolReader;
import com.treasurylens.indexer.IndexerClient;
import com.treasurylens.indexer.IndexerSettings;
import com.treasurylens.resilience.CircuitGate;
import com.treasurylens.ruleset.RulesetHistoryReconstructor;
import com.treasurylens.ruleset.RulesetService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Indexer client, ruleset service and group aggregator.
 */
@Configuration
@EnableConfigurationProperties(TreasuryLensProperties.class)
public class ServiceConfig {

    @Bean
    public IndexerClient indexerClient(WebClient.Builder webClientBuilder, TreasuryLensProperties properties,
                                       @Qualifier(GateConfig.INDEXER_GATE) CircuitGate indexerGate,
                                       ObjectMapper objectMapper) {
        TreasuryLensProperties.Indexer indexer = properties.getIndexer();
        IndexerSettings settings = new IndexerSettings(indexer.getUrl(), indexer.getTestnetUrl(), indexer.getApiKey(),
                indexer.isTestnetRoutesToMainnet(), indexer.getTimeout());
        return new IndexerClient(webClientBuilder, settings, indexerGate, objectMapper);
    }

    @Bean
    public RulesetHistoryReconstructor rulesetHistoryReconstructor() {
        return new RulesetHistoryReconstructor();
    }

    @Bean
    public RulesetService rulesetService(ContractResolver contractResolver, ProtocolReader protocolReader,
                                         TreasuryCaches treasuryCaches, RulesetHistoryReconstructor reconstructor) {
        return new RulesetService(contractResolver, protocolReader, treasuryCaches, reconstructor);
    }

    @Bean
    public SuckerGroupAggregator suckerGroupAggregator(ContractResolver contractResolver, ProtocolReader protocolReader,
                                                       RulesetService rulesetService, IndexerClient indexerClient) {
        return new SuckerGroupAggregator(contractResolver, protocolReader, rulesetService, indexerClient);
    }
}
