package com.algoexec.event;

import java.time.Instant;

/** An item on the {@link EngineEventQueue}. The engine loop dispatches on {@link #getType()}. */
public interface EngineEvent {

    EngineEventType getType();

    Instant getTimestamp();
}
