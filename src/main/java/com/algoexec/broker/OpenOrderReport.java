package com.algoexec.broker;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Contract and order terms of a working order, as delivered by the broker's open-order callback. */
@Value
@Builder
public class OpenOrderReport {

    int orderId;
    Long permId;
    Integer clientId;
    Integer parentId;
    String account;
    String symbol;
    String securityType;
    String exchange;
    String action;
    String orderType;
    BigDecimal totalQuantity;
    BigDecimal limitPrice;
    BigDecimal auxPrice;
    String status;
}
