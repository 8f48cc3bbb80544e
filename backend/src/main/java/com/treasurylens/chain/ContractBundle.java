package com.treasurylens.chain;

/**
 * Versioned contract addresses that govern one project on one chain.
 * specialVariant marks projects on the original V5 suite (revnets), which use the V5 terminal and rulesets.
 */
public record ContractBundle(
        String controller,
        String rulesets,
        String terminal,
        boolean specialVariant,
        ContractVersion version,
        boolean fallback
) {
}
