package com.treasurylens.domain;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Indexer activity feed entry. One variant per event kind; {@link Unknown} keeps kinds this build does not model.
 */
public interface ActivityEvent {

    Kind kind();

    EventContext context();

    enum Kind {
        PAY,
        PROJECT_CREATE,
        CASH_OUT,
        ADD_TO_BALANCE,
        MINT_TOKENS,
        BURN,
        DEPLOY_ERC20,
        SEND_PAYOUTS,
        SEND_RESERVED_TOKENS,
        USE_ALLOWANCE,
        MINT_NFT,
        UNKNOWN
    }

    record Pay(EventContext context, BigInteger amount, BigDecimal amountUsd) implements ActivityEvent {
        @Override
        public Kind kind() {
            return Kind.PAY;
        }
    }

    record ProjectCreate(EventContext context) implements ActivityEvent {
        @Override
        public Kind kind() {
            return Kind.PROJECT_CREATE;
        }
    }

    record CashOut(EventContext context, BigInteger reclaimAmount) implements ActivityEvent {
        @Override
        public Kind kind() {
            return Kind.CASH_OUT;
        }
    }

    record AddToBalance(EventContext context, BigInteger amount) implements ActivityEvent {
        @Override
        public Kind kind() {
            return Kind.ADD_TO_BALANCE;
        }
    }

    /** tokenCount is always in 18-decimal token units. */
    record MintTokens(EventContext context, BigInteger tokenCount, String beneficiary) implements ActivityEvent {
        @Override
        public Kind kind() {
            return Kind.MINT_TOKENS;
        }
    }

    record Burn(EventContext context, BigInteger amount) implements ActivityEvent {
        @Override
        public Kind kind() {
            return Kind.BURN;
        }
    }

    record DeployErc20(EventContext context, String symbol) implements ActivityEvent {
        @Override
        public Kind kind() {
            return Kind.DEPLOY_ERC20;
        }
    }

    record SendPayouts(EventContext context, BigInteger amount) implements ActivityEvent {
        @Override
        public Kind kind() {
            return Kind.SEND_PAYOUTS;
        }
    }

    record SendReservedTokens(EventContext context) implements ActivityEvent {
        @Override
        public Kind kind() {
            return Kind.SEND_RESERVED_TOKENS;
        }
    }

    record UseAllowance(EventContext context, BigInteger amount) implements ActivityEvent {
        @Override
        public Kind kind() {
            return Kind.USE_ALLOWANCE;
        }
    }

    record MintNft(EventContext context) implements ActivityEvent {
        @Override
        public Kind kind() {
            return Kind.MINT_NFT;
        }
    }

    /** rawPayload is the event's JSON as received. */
    record Unknown(EventContext context, String rawPayload) implements ActivityEvent {
        @Override
        public Kind kind() {
            return Kind.UNKNOWN;
        }
    }
}
