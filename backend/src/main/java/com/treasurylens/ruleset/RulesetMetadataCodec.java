package com.treasurylens.ruleset;

import com.treasurylens.common.Addresses;
import com.treasurylens.common.MetadataDecodeException;
import com.treasurylens.domain.RulesetMetadata;

import java.math.BigInteger;

/**
 * Packs and unpacks the 256-bit ruleset metadata word.
 * <pre>
 * bits   0-15   reservedPercent
 * bits  16-31   cashOutTaxRate (0-10000)
 * bits  32-63   baseCurrency
 * bits  64-78   flags, one bit each, in {@link #FLAG_COUNT} order below
 * bit   79      unused, must be clear
 * bits  80-239  dataHook address
 * bits 240-255  metadata
 * </pre>
 */
public final class RulesetMetadataCodec {

    static final int FLAG_COUNT = 15;

    private static final int CASH_OUT_TAX_SHIFT = 16;
    private static final int BASE_CURRENCY_SHIFT = 32;
    private static final int FLAGS_SHIFT = 64;
    private static final int DATA_HOOK_SHIFT = 80;
    private static final int METADATA_SHIFT = 240;

    private static final BigInteger MASK_16 = mask(16);
    private static final BigInteger MASK_32 = mask(32);
    private static final BigInteger MASK_160 = mask(160);

    private RulesetMetadataCodec() {
    }

    /**
     * @throws MetadataDecodeException if the word is negative, wider than 256 bits, or cashOutTaxRate exceeds 10000
     */
    public static RulesetMetadata decode(BigInteger word) {
        if (word == null || word.signum() < 0 || word.bitLength() > 256) {
            throw new MetadataDecodeException("Metadata word is not a uint256: " + word);
        }
        int reservedPercent = word.and(MASK_16).intValueExact();
        int cashOutTaxRate = word.shiftRight(CASH_OUT_TAX_SHIFT).and(MASK_16).intValueExact();
        if (cashOutTaxRate > RulesetMetadata.MAX_BASIS_POINTS) {
            throw new MetadataDecodeException("cashOutTaxRate " + cashOutTaxRate + " exceeds "
                    + RulesetMetadata.MAX_BASIS_POINTS);
        }
        long baseCurrency = word.shiftRight(BASE_CURRENCY_SHIFT).and(MASK_32).longValueExact();
        boolean[] f = new boolean[FLAG_COUNT];
        for (int i = 0; i < FLAG_COUNT; i++) {
            f[i] = word.testBit(FLAGS_SHIFT + i);
        }
        BigInteger hook = word.shiftRight(DATA_HOOK_SHIFT).and(MASK_160);
        int metadata = word.shiftRight(METADATA_SHIFT).and(MASK_16).intValueExact();
        return new RulesetMetadata(
                reservedPercent,
                cashOutTaxRate,
                baseCurrency,
                f[0], f[1], f[2], f[3], f[4], f[5], f[6], f[7], f[8], f[9], f[10], f[11], f[12], f[13], f[14],
                toAddress(hook),
                metadata);
    }

    /**
     * Exact inverse of {@link #decode}. Rejects fields outside their bit width and a tax rate above 10000.
     */
    public static BigInteger encode(RulesetMetadata m) {
        requireRange("reservedPercent", m.reservedPercent(), 0xFFFFL);
        requireRange("cashOutTaxRate", m.cashOutTaxRate(), RulesetMetadata.MAX_BASIS_POINTS);
        requireRange("baseCurrency", m.baseCurrency(), 0xFFFF_FFFFL);
        requireRange("metadata", m.metadata(), 0xFFFFL);
        String hook = m.dataHook() != null ? m.dataHook() : Addresses.ZERO;
        if (!Addresses.isValid(hook)) {
            throw new IllegalArgumentException("dataHook is not an address: " + hook);
        }
        boolean[] flags = {
                m.pausePay(), m.pauseCashOut(), m.pauseCreditTransfers(), m.allowOwnerMinting(),
                m.allowSetCustomToken(), m.allowTerminalMigration(), m.allowSetTerminals(), m.allowSetController(),
                m.allowAddAccountingContext(), m.allowAddPriceFeed(), m.ownerMustSendPayouts(), m.holdFees(),
                m.useTotalSurplusForCashOuts(), m.useDataHookForPay(), m.useDataHookForCashOut()
        };
        BigInteger word = BigInteger.valueOf(m.reservedPercent())
                .or(BigInteger.valueOf(m.cashOutTaxRate()).shiftLeft(CASH_OUT_TAX_SHIFT))
                .or(BigInteger.valueOf(m.baseCurrency()).shiftLeft(BASE_CURRENCY_SHIFT));
        for (int i = 0; i < FLAG_COUNT; i++) {
            if (flags[i]) {
                word = word.setBit(FLAGS_SHIFT + i);
            }
        }
        return word
                .or(new BigInteger(hook.strip().substring(2), 16).shiftLeft(DATA_HOOK_SHIFT))
                .or(BigInteger.valueOf(m.metadata()).shiftLeft(METADATA_SHIFT));
    }

    private static void requireRange(String field, long value, long max) {
        if (value < 0 || value > max) {
            throw new IllegalArgumentException(field + " out of range [0, " + max + "]: " + value);
        }
    }

    private static String toAddress(BigInteger value) {
        String hex = value.toString(16);
        return "0x" + "0".repeat(40 - hex.length()) + hex;
    }

    private static BigInteger mask(int bits) {
        return BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
    }
}
