package com.treasurylens.indexer;

import com.fasterxml.jackson.databind.JsonNode;
import com.treasurylens.common.Addresses;
import com.treasurylens.common.UpstreamException;
import com.treasurylens.domain.CashOutEvent;
import com.treasurylens.domain.Page;
import com.treasurylens.domain.Participant;
import com.treasurylens.domain.PayEvent;
import com.treasurylens.domain.Project;
import com.treasurylens.domain.SuckerGroup;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Maps indexer JSON to domain records. Amounts arrive as decimal strings or numbers; a malformed row fails the
 * whole response with {@link UpstreamException}.
 */
final class IndexerResponses {

    private IndexerResponses() {
    }

    static IndexedProject indexedProject(JsonNode node) {
        Project project = project(node);
        JsonNode group = node.path("suckerGroup");
        return new IndexedProject(project, isAbsent(group) ? null : suckerGroup(group));
    }

    static Project project(JsonNode n) {
        return new Project(
                requiredLong(n, "projectId"),
                requiredLong(n, "chainId"),
                (int) optionalLong(n, "version", 5L),
                text(n, "handle"),
                Addresses.normalize(text(n, "owner")),
                text(n, "metadataUri"),
                bigInteger(n.path("balance")),
                bigInteger(n.path("volume")),
                bigDecimal(n.path("volumeUsd")),
                optionalLong(n, "paymentsCount", 0L),
                optionalInt(n, "decimals"),
                optionalInt(n, "currency"),
                Addresses.normalize(text(n, "token")),
                text(n, "tokenSymbol"),
                bigInteger(n.path("tokenSupply")),
                text(n, "suckerGroupId"),
                isAbsent(n.path("createdAt")) ? null : Instant.ofEpochSecond(n.path("createdAt").asLong()));
    }

    static SuckerGroup suckerGroup(JsonNode n) {
        List<Project> projects = new ArrayList<>();
        for (JsonNode item : n.path("projects").path("items")) {
            projects.add(project(item));
        }
        JsonNode payments = n.path("paymentsCount");
        return new SuckerGroup(
                text(n, "id"),
                bigInteger(n.path("balance")),
                bigInteger(n.path("volume")),
                bigInteger(n.path("tokenSupply")),
                isAbsent(payments) ? null : payments.asLong(),
                projects);
    }

    static Participant participant(JsonNode n) {
        return new Participant(Addresses.normalize(text(n, "address")), requiredLong(n, "chainId"),
                orZero(bigInteger(n.path("balance"))));
    }

    static PayEvent payEvent(JsonNode n) {
        return new PayEvent(orZero(bigInteger(n.path("amount"))), orZero(bigInteger(n.path("newlyIssuedTokenCount"))),
                n.path("timestamp").asLong());
    }

    static CashOutEvent cashOutEvent(JsonNode n) {
        return new CashOutEvent(Addresses.normalize(text(n, "holder")), orZero(bigInteger(n.path("cashOutCount"))),
                orZero(bigInteger(n.path("reclaimAmount"))), n.path("timestamp").asLong());
    }

    /**
     * Reads {@code items} and {@code pageInfo} of a connection node; a null connection is an empty page.
     */
    static <T> Page<T> page(JsonNode connection, Function<JsonNode, T> mapper) {
        if (isAbsent(connection)) {
            return Page.empty();
        }
        List<T> items = new ArrayList<>();
        for (JsonNode item : connection.path("items")) {
            items.add(mapper.apply(item));
        }
        JsonNode pageInfo = connection.path("pageInfo");
        boolean hasNext = pageInfo.path("hasNextPage").asBoolean(false);
        String endCursor = isAbsent(pageInfo.path("endCursor")) ? null : pageInfo.path("endCursor").asText();
        return new Page<>(items, hasNext, endCursor);
    }

    static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    static String text(JsonNode n, String field) {
        JsonNode v = n.path(field);
        return isAbsent(v) ? null : v.asText();
    }

    static BigInteger bigInteger(JsonNode v) {
        BigDecimal d = bigDecimal(v);
        return d != null ? d.toBigInteger() : null;
    }

    static BigDecimal bigDecimal(JsonNode v) {
        if (isAbsent(v)) {
            return null;
        }
        if (v.isNumber()) {
            return v.decimalValue();
        }
        String s = v.asText().strip();
        if (s.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(s);
        } catch (NumberFormatException e) {
            throw new UpstreamException("Indexer returned non-numeric amount '" + s + "'", e);
        }
    }

    static Integer optionalInt(JsonNode n, String field) {
        JsonNode v = n.path(field);
        return isAbsent(v) ? null : v.asInt();
    }

    private static long optionalLong(JsonNode n, String field, long defaultValue) {
        JsonNode v = n.path(field);
        return isAbsent(v) ? defaultValue : v.asLong(defaultValue);
    }

    private static long requiredLong(JsonNode n, String field) {
        JsonNode v = n.path(field);
        if (isAbsent(v)) {
            throw new UpstreamException("Indexer row is missing " + field);
        }
        return v.asLong();
    }

    private static BigInteger orZero(BigInteger v) {
        return v != null ? v : BigInteger.ZERO;
    }
}
