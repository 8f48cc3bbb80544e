package com.treasurylens.domain;

public enum CycleStatus {
    PAST,
    CURRENT
}
