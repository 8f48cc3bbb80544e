package com.treasurylens.domain;

/**
 * Accounting currency codes used by the protocol. Unknown codes resolve to ETH.
 */
public enum Currency {
    ETH(1, 18, "ETH"),
    USD(2, 6, "USDC");

    private final int code;
    private final int defaultDecimals;
    private final String symbol;

    Currency(int code, int defaultDecimals, String symbol) {
        this.code = code;
        this.defaultDecimals = defaultDecimals;
        this.symbol = symbol;
    }

    public int getCode() {
        return code;
    }

    public int getDefaultDecimals() {
        return defaultDecimals;
    }

    public String getSymbol() {
        return symbol;
    }

    public static Currency fromCode(Integer code) {
        return code != null && code == USD.code ? USD : ETH;
    }

    /**
     * Token decimals take precedence over the reported currency code: 6 decimals always means the stable unit.
     */
    public static Currency infer(Integer decimals, Integer currencyCode) {
        if (decimals != null && decimals == 6) {
            return USD;
        }
        return fromCode(currencyCode);
    }
}
