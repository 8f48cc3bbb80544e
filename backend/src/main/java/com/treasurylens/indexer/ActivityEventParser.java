package com.treasurylens.indexer;

import com.fasterxml.jackson.databind.JsonNode;
import com.treasurylens.common.Addresses;
import com.treasurylens.domain.ActivityEvent;
import com.treasurylens.domain.EventContext;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiFunction;

import static com.treasurylens.indexer.IndexerResponses.bigDecimal;
import static com.treasurylens.indexer.IndexerResponses.bigInteger;
import static com.treasurylens.indexer.IndexerResponses.isAbsent;
import static com.treasurylens.indexer.IndexerResponses.optionalInt;
import static com.treasurylens.indexer.IndexerResponses.text;

/**
 * Turns an activity feed row into its typed variant. Exactly one event sub-object is populated per row;
 * the first non-null one in declaration order wins, and a row with none becomes {@link ActivityEvent.Unknown}.
 */
final class ActivityEventParser {

    private static final Map<String, BiFunction<EventContext, JsonNode, ActivityEvent>> VARIANTS = new LinkedHashMap<>();

    static {
        VARIANTS.put("payEvent", (ctx, e) -> new ActivityEvent.Pay(ctx, bigInteger(e.path("amount")), bigDecimal(e.path("amountUsd"))));
        VARIANTS.put("projectCreateEvent", (ctx, e) -> new ActivityEvent.ProjectCreate(ctx));
        VARIANTS.put("cashOutTokensEvent", (ctx, e) -> new ActivityEvent.CashOut(ctx, bigInteger(e.path("reclaimAmount"))));
        VARIANTS.put("addToBalanceEvent", (ctx, e) -> new ActivityEvent.AddToBalance(ctx, bigInteger(e.path("amount"))));
        VARIANTS.put("mintTokensEvent", (ctx, e) -> new ActivityEvent.MintTokens(ctx, bigInteger(e.path("tokenCount")),
                Addresses.normalize(text(e, "beneficiary"))));
        VARIANTS.put("burnEvent", (ctx, e) -> new ActivityEvent.Burn(ctx, bigInteger(e.path("amount"))));
        VARIANTS.put("deployErc20Event", (ctx, e) -> new ActivityEvent.DeployErc20(ctx, text(e, "symbol")));
        VARIANTS.put("sendPayoutsEvent", (ctx, e) -> new ActivityEvent.SendPayouts(ctx, bigInteger(e.path("amount"))));
        VARIANTS.put("sendReservedTokensToSplitsEvent", (ctx, e) -> new ActivityEvent.SendReservedTokens(ctx));
        VARIANTS.put("useAllowanceEvent", (ctx, e) -> new ActivityEvent.UseAllowance(ctx, bigInteger(e.path("amount"))));
        VARIANTS.put("mintNftEvent", (ctx, e) -> new ActivityEvent.MintNft(ctx));
    }

    private ActivityEventParser() {
    }

    static ActivityEvent parse(JsonNode row) {
        EventContext ctx = context(row);
        for (Map.Entry<String, BiFunction<EventContext, JsonNode, ActivityEvent>> variant : VARIANTS.entrySet()) {
            JsonNode payload = row.path(variant.getKey());
            if (!isAbsent(payload)) {
                return variant.getValue().apply(ctx, payload);
            }
        }
        return new ActivityEvent.Unknown(ctx, row.toString());
    }

    private static EventContext context(JsonNode row) {
        JsonNode project = row.path("project");
        return new EventContext(
                text(row, "id"),
                row.path("chainId").asLong(),
                project.path("projectId").asLong(),
                row.path("timestamp").asLong(),
                Addresses.normalize(text(row, "from")),
                text(row, "txHash"),
                text(project, "name"),
                text(project, "handle"),
                optionalInt(project, "decimals"),
                optionalInt(project, "currency"));
    }
}
