package com.treasurylens.chain;

/**
 * Protocol contract generation governing a project. V5 and V5.1 suites must never be mixed.
 */
public enum ContractVersion {
    V5,
    V5_1,
    /** Controller outside the known set; paired with the V5.1 rulesets and terminal. */
    UNKNOWN
}
