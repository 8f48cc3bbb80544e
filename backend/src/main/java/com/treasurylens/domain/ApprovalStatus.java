package com.treasurylens.domain;

/**
 * Status of a queued ruleset against its approval hook, ordinal-aligned with JBApprovalStatus.
 */
public enum ApprovalStatus {
    EMPTY,
    UPCOMING,
    ACTIVE,
    APPROVAL_EXPECTED,
    APPROVED,
    FAILED;

    public static ApprovalStatus fromOrdinal(int ordinal) {
        ApprovalStatus[] values = values();
        return ordinal >= 0 && ordinal < values.length ? values[ordinal] : EMPTY;
    }
}
