package com.algoexec.exception;

import java.util.Map;

/** A price lookup for a ticker the order book has never received data for. */
public class PriceNotFoundException extends BaseException {

    public PriceNotFoundException(String ticker) {
        super(ErrorCode.PRICE_NOT_FOUND, "No market data for ticker: " + ticker, Map.of("ticker", ticker));
    }
}
