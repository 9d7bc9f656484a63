package com.algoexec.event;

import com.algoexec.domain.model.TradeInstruction;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Value;

/**
 * A strategy decision: one or more instructions that are executed together or not at all.
 *
 * <p>{@code tradeCapital} sizes instructions that carry no explicit quantity; it may be null
 * when every instruction has one.
 */
@Value
public class SignalEvent implements EngineEvent {

    Instant timestamp;
    BigDecimal tradeCapital;
    List<TradeInstruction> instructions;

    public SignalEvent(Instant timestamp, BigDecimal tradeCapital, List<TradeInstruction> instructions) {
        if (instructions == null || instructions.isEmpty()) {
            throw new IllegalArgumentException("Signal must carry at least one instruction");
        }
        this.timestamp = timestamp;
        this.tradeCapital = tradeCapital;
        this.instructions = List.copyOf(instructions);
    }

    public List<String> tickers() {
        return instructions.stream().map(TradeInstruction::getTicker).toList();
    }

    @Override
    public EngineEventType getType() {
        return EngineEventType.SIGNAL;
    }
}
