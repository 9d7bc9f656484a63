package com.algoexec.exception;

import java.util.Map;

public class InstrumentNotFoundException extends BaseException {

    public InstrumentNotFoundException(String ticker) {
        super(ErrorCode.NOT_FOUND, "Instrument not registered: " + ticker, Map.of("ticker", ticker));
    }
}
