package com.algoexec.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** A stored bar together with the data ticker it belongs to. */
@Value
@Builder
@Jacksonized
public class HistoricalBar {

    String ticker;
    Bar bar;
}
