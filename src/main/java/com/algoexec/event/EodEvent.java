package com.algoexec.event;

import java.time.Instant;
import lombok.Value;

/** Marks the last market-data batch of a trading day. */
@Value
public class EodEvent implements EngineEvent {

    Instant timestamp;

    @Override
    public EngineEventType getType() {
        return EngineEventType.EOD;
    }
}
