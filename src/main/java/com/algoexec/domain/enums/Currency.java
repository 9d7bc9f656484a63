package com.algoexec.domain.enums;

public enum Currency {
    USD,
    CAD,
    EUR,
    GBP,
    AUD,
    JPY
}
