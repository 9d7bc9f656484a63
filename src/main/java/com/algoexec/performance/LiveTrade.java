package com.algoexec.performance;

import com.algoexec.broker.ExecutionReport;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** A live fill with the commission back-filled once the broker reports it. */
@Value
@Builder(toBuilder = true)
public class LiveTrade {

    ExecutionReport execution;
    BigDecimal commission;
}
