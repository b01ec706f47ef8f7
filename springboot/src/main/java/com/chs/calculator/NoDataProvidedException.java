package com.chs.calculator;

public class NoDataProvidedException extends CalculationException {

    public NoDataProvidedException() {
        super("No data provided");
    }
}
