package com.algoexec.domain.model;

import com.algoexec.domain.enums.Action;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** A fill produced by the simulator. Value-equal records are the same trade. */
@Value
@Builder
public class Execution {

    Instant timestamp;
    long tradeId;
    long legId;
    String ticker;
    BigDecimal quantity;
    BigDecimal fillPrice;
    BigDecimal notional;
    Action action;
    BigDecimal fees;
}
