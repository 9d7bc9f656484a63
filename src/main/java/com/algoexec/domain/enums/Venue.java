package com.algoexec.domain.enums;

/** Listing venues. SMART and ISLAND are broker routing destinations. */
public enum Venue {
    NASDAQ,
    NYSE,
    CME,
    CBOT,
    CBOE,
    COMEX,
    GLOBEX,
    NYMEX,
    INDEX,
    SMART,
    ISLAND
}
