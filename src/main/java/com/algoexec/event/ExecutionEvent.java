package com.algoexec.event;

import com.algoexec.domain.model.Execution;
import java.time.Instant;
import lombok.Value;

/** Emitted once per simulated fill, including liquidation fills. */
@Value
public class ExecutionEvent implements EngineEvent {

    Execution execution;

    @Override
    public Instant getTimestamp() {
        return execution.getTimestamp();
    }

    @Override
    public EngineEventType getType() {
        return EngineEventType.EXECUTION;
    }
}
