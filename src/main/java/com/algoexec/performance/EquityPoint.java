package com.algoexec.performance;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Value;

@Value
public class EquityPoint {

    Instant timestamp;
    BigDecimal equity;
}
