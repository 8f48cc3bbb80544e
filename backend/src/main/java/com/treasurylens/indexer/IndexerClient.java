package com.treasurylens.indexer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.treasurylens.common.UpstreamException;
import com.treasurylens.domain.ActivityEvent;
import com.treasurylens.domain.CashOutEvent;
import com.treasurylens.domain.Chain;
import com.treasurylens.domain.Page;
import com.treasurylens.domain.PayEvent;
import com.treasurylens.domain.SuckerGroup;
import com.treasurylens.resilience.CircuitGate;
import com.treasurylens.resilience.GateResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * GraphQL client for the protocol indexer. Every request runs inside the indexer {@link CircuitGate}; transport
 * errors and GraphQL {@code errors} count as gate failures and surface as {@link UpstreamException}.
 * A null root entity is reported as an empty Mono (or an empty page for feeds).
 */
@Slf4j
public class IndexerClient {

    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final int RECENT_PAY_EVENTS = 5;

    private final WebClient webClient;
    private final IndexerSettings settings;
    private final CircuitGate indexerGate;
    private final ObjectMapper objectMapper;

    public IndexerClient(WebClient.Builder webClientBuilder, IndexerSettings settings, CircuitGate indexerGate,
                         ObjectMapper objectMapper) {
        this.webClient = webClientBuilder.build();
        this.settings = settings;
        this.indexerGate = indexerGate;
        this.objectMapper = objectMapper;
    }

    /**
     * Project with its sucker group, including the group's member projects and pre-aggregated totals.
     */
    public Mono<IndexedProject> project(long projectId, Chain chain, int version) {
        Map<String, Object> vars = variables("projectId", projectId, "chainId", chain.getId(), "version", version);
        return query(chain, "project", IndexerQueries.PROJECT, vars)
                .map(data -> data.path("project"))
                .filter(node -> !IndexerResponses.isAbsent(node))
                .map(IndexerResponses::indexedProject);
    }

    /**
     * Sucker group by id. The chain only selects the indexer deployment (mainnet or testnet).
     */
    public Mono<SuckerGroup> suckerGroup(String suckerGroupId, Chain chain) {
        return query(chain, "suckerGroup", IndexerQueries.SUCKER_GROUP, variables("id", suckerGroupId))
                .map(data -> data.path("suckerGroup"))
                .filter(node -> !IndexerResponses.isAbsent(node))
                .map(IndexerResponses::suckerGroup);
    }

    public Mono<ParticipantPage> participantsByProject(long projectId, Chain chain, int limit, String after) {
        Map<String, Object> vars = variables("projectId", projectId, "chainId", chain.getId(), "limit", limit, "after", after);
        return query(chain, "participants", IndexerQueries.PARTICIPANTS_BY_PROJECT, vars)
                .map(data -> participantPage(data.path("participants")));
    }

    public Mono<ParticipantPage> participantsByGroup(String suckerGroupId, Chain chain, int limit, String after) {
        Map<String, Object> vars = variables("suckerGroupId", suckerGroupId, "limit", limit, "after", after);
        return query(chain, "participants", IndexerQueries.PARTICIPANTS_BY_GROUP, vars)
                .map(data -> participantPage(data.path("participants")));
    }

    /**
     * Latest pay events, newest first.
     */
    public Mono<List<PayEvent>> recentPayEvents(long projectId, Chain chain, int version, int limit) {
        return payEventsPage(projectId, chain, version, limit, null).map(Page::items);
    }

    public Mono<Page<PayEvent>> payEventsPage(long projectId, Chain chain, int version, int limit, String after) {
        Map<String, Object> vars = variables("projectId", projectId, "chainId", chain.getId(), "version", version,
                "limit", limit, "after", after);
        return query(chain, "payEvents", IndexerQueries.PAY_EVENTS, vars)
                .map(data -> IndexerResponses.page(data.path("payEvents"), IndexerResponses::payEvent));
    }

    public Mono<Page<CashOutEvent>> cashOutEventsPage(long projectId, Chain chain, int version, int limit, String after) {
        Map<String, Object> vars = variables("projectId", projectId, "chainId", chain.getId(), "version", version,
                "limit", limit, "after", after);
        return query(chain, "cashOutTokensEvents", IndexerQueries.CASH_OUT_EVENTS, vars)
                .map(data -> IndexerResponses.page(data.path("cashOutTokensEvents"), IndexerResponses::cashOutEvent));
    }

    /**
     * Protocol-wide activity feed, newest first.
     */
    public Mono<Page<ActivityEvent>> activityEvents(Chain chain, int limit, String after) {
        return query(chain, "activityEvents", IndexerQueries.ACTIVITY_EVENTS, variables("limit", limit, "after", after))
                .map(data -> IndexerResponses.page(data.path("activityEvents"), ActivityEventParser::parse));
    }

    private Mono<JsonNode> query(Chain chain, String operation, String document, Map<String, Object> vars) {
        String url = settings.urlFor(chain);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", document);
        body.put("variables", vars);
        return indexerGate.<JsonNode>call(operation, vars, () -> webClient.post()
                        .uri(url)
                        .contentType(MediaType.APPLICATION_JSON)
                        .headers(headers -> {
                            if (settings.hasApiKey()) {
                                headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + settings.apiKey());
                            }
                        })
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(String.class)
                        .timeout(settings.timeout())
                        .map(json -> data(operation, json))
                        .onErrorMap(WebClientResponseException.class,
                                e -> new UpstreamException("Indexer " + operation + " HTTP " + e.getStatusCode().value(), e))
                        .onErrorMap(WebClientRequestException.class,
                                e -> new UpstreamException("Indexer " + operation + " request failed: " + e.getMessage(), e))
                        .onErrorMap(TimeoutException.class,
                                e -> new UpstreamException("Indexer " + operation + " timed out after " + settings.timeout(), e)))
                .flatMap(GateResult::toMono)
                .doOnNext(data -> log.debug("Indexer {} on chain {} answered", operation, chain.getId()));
    }

    private JsonNode data(String operation, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UpstreamException("Indexer " + operation + " returned malformed JSON", e);
        }
        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new UpstreamException("Indexer " + operation + " errors: " + errors.get(0).path("message").asText(errors.toString()));
        }
        JsonNode data = root.path("data");
        if (IndexerResponses.isAbsent(data)) {
            throw new UpstreamException("Indexer " + operation + " returned no data");
        }
        return data;
    }

    private static ParticipantPage participantPage(JsonNode connection) {
        long total = connection.path("totalCount").asLong(0L);
        return new ParticipantPage(IndexerResponses.page(connection, IndexerResponses::participant), total);
    }

    private static Map<String, Object> variables(Object... keyValues) {
        Map<String, Object> vars = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            vars.put((String) keyValues[i], keyValues[i + 1]);
        }
        return vars;
    }
}
